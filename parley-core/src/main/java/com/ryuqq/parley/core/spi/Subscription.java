package com.ryuqq.parley.core.spi;

/**
 * Handle returned by {@link EventBus#subscribe(Class, EventListener)}.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    /**
     * Stops delivery to the listener. Idempotent.
     */
    void cancel();

    boolean isActive();

    @Override
    default void close() {
        cancel();
    }
}
