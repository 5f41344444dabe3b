/**
 * Events published on the process-wide {@link com.ryuqq.parley.core.spi.EventBus}.
 *
 * <h2>Events</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parley.core.event.ChannelCreatedEvent} - exactly once per channel</li>
 *   <li>{@link com.ryuqq.parley.core.event.MessageDeliveredEvent} - one per recipient of a delivered message</li>
 *   <li>{@link com.ryuqq.parley.core.event.StreamEvent} - start, chunk and complete, one per streaming recipient</li>
 *   <li>{@link com.ryuqq.parley.core.event.MeetingStateChangedEvent} - FORMING, ACTIVE, ENDED transitions</li>
 * </ul>
 *
 * <p>Events addressed to a recipient implement {@link com.ryuqq.parley.core.event.AddressedEvent}
 * so a presentation layer can filter per viewer.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.core.event;
