package com.ryuqq.parley.testkit.contract;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.spi.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double whose delivery always throws.
 *
 * <p>Used to verify that one failing recipient does not stop a fan-out.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class FailingParticipant implements Participant {

    private static final Logger log = LoggerFactory.getLogger(FailingParticipant.class);

    private final ParticipantId id;
    private final AtomicInteger attempts = new AtomicInteger();

    public FailingParticipant(ParticipantId id) {
        this.id = id;
    }

    @Override
    public ParticipantId id() {
        return id;
    }

    @Override
    public void deliver(Message message) {
        int attempt = attempts.incrementAndGet();
        log.debug("Rejecting delivery #{} of {} to {}", attempt, message.id(), id);
        throw new IllegalStateException("Simulated delivery failure for " + id);
    }

    /**
     * Number of delivery attempts made so far.
     */
    public int attempts() {
        return attempts.get();
    }
}
