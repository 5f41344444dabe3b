/**
 * In-memory {@link com.ryuqq.parley.core.spi.Inbox} implementation.
 *
 * <p>Condition-variable queue: every put wakes all waiters, and no waiter ever sleeps on a fixed interval.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.adapter.inmemory.inbox;
