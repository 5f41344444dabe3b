package com.ryuqq.parley.core.spi;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.IdKind;
import com.ryuqq.parley.core.model.ParticipantId;

/**
 * Minimal capability a deliverable target must satisfy.
 *
 * <p>Agents and humans are treated uniformly through this contract. The in-process shapes hand the
 * message to the participant's own inbox; a transport-backed implementation can be added without
 * changing channels or meetings.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: {@link #deliver(Message)} may be called concurrently from many senders</li>
 *   <li>Non-blocking: delivery must not wait for the participant to read the message</li>
 *   <li>Failure: a failed delivery throws; the channel isolates it from sibling recipients</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public interface Participant {

    /**
     * Returns the participant identity.
     *
     * @return participant id, never null
     */
    ParticipantId id();

    /**
     * Returns the participant kind.
     *
     * @return AGENT or HUMAN
     */
    default IdKind kind() {
        return id().kind();
    }

    /**
     * Returns the name other participants use to address this one in free text.
     *
     * @return display name, defaults to the raw id value
     */
    default String displayName() {
        return id().getValue();
    }

    /**
     * Whether this participant can render a reply incrementally (stream chunks).
     *
     * @return true if stream events should be produced for this participant
     */
    default boolean supportsIncrementalDisplay() {
        return false;
    }

    /**
     * Hands a message to this participant.
     *
     * @param message the message to deliver
     * @throws RuntimeException if the message could not be accepted
     */
    void deliver(Message message);
}
