/**
 * Meeting lifecycle on top of channels, messages and inboxes.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parley.adapter.router.meeting.Meeting} - membership, quorum condition, bounded history,
 *       read cursors, shared state</li>
 *   <li>{@link com.ryuqq.parley.adapter.router.meeting.MeetingManager} - the
 *       {@link com.ryuqq.parley.application.meeting.MeetingCoordinator} implementation and all meeting notices</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * <p>Each meeting guards its state with one lock. Quorum waiters suspend on a condition of that lock and
 * are woken by join, reject and end. Notices are sent after the lock is released.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.adapter.router.meeting;
