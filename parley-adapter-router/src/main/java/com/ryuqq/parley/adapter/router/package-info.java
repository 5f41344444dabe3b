/**
 * In-process router: participants, channels, streams and meetings wired together.
 *
 * <h2>Entry Point</h2>
 * <p>{@link com.ryuqq.parley.adapter.router.ParleyRouter} implements
 * {@link com.ryuqq.parley.application.router.MessageRouter} and exposes the
 * {@link com.ryuqq.parley.application.meeting.MeetingCoordinator}.</p>
 *
 * <h2>Configuration</h2>
 * <p>{@link com.ryuqq.parley.adapter.router.ParleyConfig} holds the quorum timeout, the targeted and passive
 * wait windows, batch size, history limit and the first meeting number.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.adapter.router;
