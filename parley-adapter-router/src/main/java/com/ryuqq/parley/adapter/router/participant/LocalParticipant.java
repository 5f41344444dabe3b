package com.ryuqq.parley.adapter.router.participant;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.spi.Inbox;
import com.ryuqq.parley.core.spi.Participant;

/**
 * 프로세스 내 참가자의 공통 구현.
 *
 * <p>전달은 참가자 자신의 {@link Inbox}에 넣는 것으로 끝나며, 읽기는 참가자 쪽 스레드가
 * {@link Inbox#getBatch}로 수행합니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public abstract class LocalParticipant implements Participant {

    private final ParticipantId id;
    private final String displayName;
    private final Inbox inbox;

    protected LocalParticipant(ParticipantId id, String displayName, Inbox inbox) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (inbox == null) {
            throw new IllegalArgumentException("inbox cannot be null");
        }
        this.id = id;
        this.displayName = displayName == null || displayName.isBlank() ? id.getValue() : displayName;
        this.inbox = inbox;
    }

    @Override
    public ParticipantId id() {
        return id;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    /**
     * 받은편지함.
     *
     * @return 이 참가자의 Inbox
     */
    public Inbox inbox() {
        return inbox;
    }

    @Override
    public void deliver(Message message) {
        inbox.put(message);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", displayName=" + displayName + "}";
    }
}
