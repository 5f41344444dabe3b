/**
 * Immutable message record and its type tag.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parley.core.message.Message} - one unit of communication, 1:1 or group</li>
 *   <li>{@link com.ryuqq.parley.core.message.MessageType} - direct, broadcast, invitation, invitation response</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.core.message;
