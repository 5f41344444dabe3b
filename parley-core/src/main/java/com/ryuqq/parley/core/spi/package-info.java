/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the seams that adapter modules implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parley.core.spi.Participant} - minimal deliver-a-message capability</li>
 *   <li>{@link com.ryuqq.parley.core.spi.Inbox} - per-participant event-driven queue</li>
 *   <li>{@link com.ryuqq.parley.core.spi.EventBus} - process-wide publish/subscribe with error isolation</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>parley-adapter-inmemory provides {@code InMemoryInbox} and {@code InMemoryEventBus};
 * parley-adapter-router provides the agent and human participants.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.core.spi;
