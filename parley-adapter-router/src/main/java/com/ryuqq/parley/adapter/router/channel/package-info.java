/**
 * Channels: the single routing abstraction for 1:1, 1:N and N:N traffic.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parley.adapter.router.channel.Channel} - participant set, error-isolated fan-out, open streams</li>
 *   <li>{@link com.ryuqq.parley.adapter.router.channel.ChannelRegistry} - atomic get-or-create, one created event per channel</li>
 *   <li>{@link com.ryuqq.parley.adapter.router.channel.StreamState} - accumulated content of one open stream</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.adapter.router.channel;
