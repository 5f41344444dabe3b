package com.ryuqq.parley.core.spi;

import com.ryuqq.parley.core.event.ParleyEvent;

/**
 * Subscriber callback for {@link EventBus}.
 *
 * @param <E> event type
 * @author Parley Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventListener<E extends ParleyEvent> {

    /**
     * Handles one event. Exceptions thrown here are isolated by the bus.
     *
     * @param event the published event
     */
    void onEvent(E event);
}
