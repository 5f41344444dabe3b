/**
 * Meeting coordination port.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parley.application.meeting.MeetingCoordinator} - lifecycle, quorum, membership, broadcast</li>
 *   <li>{@link com.ryuqq.parley.application.meeting.MeetingView} - immutable snapshot of one meeting</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.application.meeting;
