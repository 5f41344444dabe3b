package com.ryuqq.parley.adapter.inmemory.event;

import com.ryuqq.parley.core.event.ParleyEvent;
import com.ryuqq.parley.core.spi.EventBus;
import com.ryuqq.parley.core.spi.EventListener;
import com.ryuqq.parley.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link EventBus} SPI.
 *
 * <p>Listeners are kept in a {@link CopyOnWriteArrayList} so publishing iterates a stable snapshot
 * while other threads subscribe or cancel. Each listener runs inside its own try/catch: a failing
 * listener is logged and counted, and the remaining listeners still receive the event.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventBus bus = new InMemoryEventBus();
 * Subscription sub = bus.subscribe(ChannelCreatedEvent.class, e -&gt; log.info("created {}", e.channelId()));
 * bus.publish(new ChannelCreatedEvent(...));
 * sub.cancel();
 * </pre>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();
    private final AtomicLong listenerFailures = new AtomicLong();

    @Override
    public void publish(ParleyEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        for (Registration<?> registration : registrations) {
            if (registration.accepts(event)) {
                try {
                    registration.dispatch(event);
                } catch (RuntimeException e) {
                    listenerFailures.incrementAndGet();
                    log.warn("Listener for {} failed on {}, continuing with remaining listeners",
                        registration.type.getSimpleName(), event.getClass().getSimpleName(), e);
                }
            }
        }
    }

    @Override
    public <E extends ParleyEvent> Subscription subscribe(Class<E> type, EventListener<? super E> listener) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        Registration<E> registration = new Registration<>(type, listener);
        registrations.add(registration);
        return registration;
    }

    @Override
    public int subscriberCount() {
        return registrations.size();
    }

    /**
     * Number of listener invocations that threw since creation.
     *
     * @return failure count
     */
    public long listenerFailures() {
        return listenerFailures.get();
    }

    /**
     * Removes every subscription.
     */
    public void clear() {
        for (Registration<?> registration : registrations) {
            registration.cancel();
        }
    }

    private final class Registration<E extends ParleyEvent> implements Subscription {

        private final Class<E> type;
        private final EventListener<? super E> listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(Class<E> type, EventListener<? super E> listener) {
            this.type = type;
            this.listener = listener;
        }

        private boolean accepts(ParleyEvent event) {
            return active.get() && type.isInstance(event);
        }

        private void dispatch(ParleyEvent event) {
            listener.onEvent(type.cast(event));
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                registrations.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
