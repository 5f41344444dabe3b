/**
 * In-memory {@link com.ryuqq.parley.core.spi.EventBus} implementation.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Synchronous dispatch in subscription order</li>
 *   <li>Per-listener error isolation with a WARN log</li>
 *   <li>Supertype subscriptions receive subtypes ({@code ParleyEvent.class} receives everything)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.adapter.inmemory.event;
