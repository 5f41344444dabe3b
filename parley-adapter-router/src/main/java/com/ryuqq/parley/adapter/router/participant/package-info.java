/**
 * In-process participant shapes.
 *
 * <h2>Participants</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parley.adapter.router.participant.AgentParticipant} - agent inbox, no incremental display</li>
 *   <li>{@link com.ryuqq.parley.adapter.router.participant.HumanParticipant} - human inbox with
 *       {@link com.ryuqq.parley.adapter.router.participant.DeliveryPreferences}</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.parley.adapter.router.participant.AddressingRules} decides whether a message targets
 * a participant: explicit target ids first, name mention in the content as a fallback.</p>
 *
 * @since 1.0.0
 * @author Parley Team
 */
package com.ryuqq.parley.adapter.router.participant;
