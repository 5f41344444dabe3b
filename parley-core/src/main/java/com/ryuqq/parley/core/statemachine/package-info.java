/**
 * Meeting lifecycle state machine.
 *
 * <h2>States</h2>
 * <p>{@code FORMING → ACTIVE → ENDED}, plus {@code FORMING → ENDED}. Transitions are one-directional
 * and validated by {@link com.ryuqq.parley.core.statemachine.MeetingTransition}.</p>
 *
 * <h2>Invitations</h2>
 * <p>{@link com.ryuqq.parley.core.statemachine.MeetingInvitation} moves from {@code PENDING} to
 * {@code JOINED} or {@code REJECTED} exactly once.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.core.statemachine;
