package com.ryuqq.parley.testkit.contract;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.spi.Participant;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double that records every delivered message.
 *
 * <p>Useful where a test needs a participant without an inbox, for example to model a
 * transport-backed participant or a display-capable client.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class RecordingParticipant implements Participant {

    private final ParticipantId id;
    private final String displayName;
    private final boolean incrementalDisplay;
    private final List<Message> received = new CopyOnWriteArrayList<>();

    public RecordingParticipant(ParticipantId id) {
        this(id, id.getValue(), false);
    }

    public RecordingParticipant(ParticipantId id, String displayName, boolean incrementalDisplay) {
        this.id = id;
        this.displayName = displayName;
        this.incrementalDisplay = incrementalDisplay;
    }

    @Override
    public ParticipantId id() {
        return id;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public boolean supportsIncrementalDisplay() {
        return incrementalDisplay;
    }

    @Override
    public void deliver(Message message) {
        received.add(message);
    }

    /**
     * Messages delivered so far, in delivery order.
     */
    public List<Message> received() {
        return List.copyOf(received);
    }

    public int receivedCount() {
        return received.size();
    }

    public void clear() {
        received.clear();
    }
}
