package com.ryuqq.parley.core.spi;

import com.ryuqq.parley.core.event.ParleyEvent;

/**
 * Process-wide publish/subscribe mechanism.
 *
 * <p>Every "something happened" notification (channel created, message delivered, stream phases,
 * meeting state changes) goes through this single bus instead of per-feature callback lists.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: publish and subscribe may be called concurrently</li>
 *   <li>Error isolation: a listener that throws must not prevent delivery to the others,
 *       and must not propagate to the publisher</li>
 *   <li>Type matching: a listener subscribed to a supertype receives every subtype</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public interface EventBus {

    /**
     * Publishes an event to every matching listener synchronously, in subscription order.
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if event is null
     */
    void publish(ParleyEvent event);

    /**
     * Subscribes a listener to an event type and its subtypes.
     *
     * @param type event type ({@code ParleyEvent.class} for all events)
     * @param listener the callback
     * @param <E> event type
     * @return subscription handle
     * @throws IllegalArgumentException if type or listener is null
     */
    <E extends ParleyEvent> Subscription subscribe(Class<E> type, EventListener<? super E> listener);

    /**
     * Number of active subscriptions.
     */
    int subscriberCount();
}
