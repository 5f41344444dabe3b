package com.ryuqq.parley.adapter.router.participant;

import com.ryuqq.parley.core.exception.UnknownRecipientException;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.spi.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 참가자 ID에서 참가자로의 레지스트리.
 *
 * <p>등록은 {@link ConcurrentHashMap#putIfAbsent}로 원자적으로 처리됩니다.
 * 조회 실패는 대체 참가자를 추측하지 않고 {@link UnknownRecipientException}으로 알립니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class ParticipantDirectory {

    private static final Logger log = LoggerFactory.getLogger(ParticipantDirectory.class);

    private final Map<ParticipantId, Participant> participants = new ConcurrentHashMap<>();

    /**
     * 참가자 등록. 같은 인스턴스의 재등록은 무시합니다.
     *
     * @throws IllegalStateException 같은 ID로 다른 인스턴스가 등록된 경우
     */
    public void register(Participant participant) {
        if (participant == null) {
            throw new IllegalArgumentException("participant cannot be null");
        }
        Participant existing = participants.putIfAbsent(participant.id(), participant);
        if (existing != null && existing != participant) {
            throw new IllegalStateException("Participant already registered: " + participant.id());
        }
        if (existing == null) {
            log.info("Registered participant {} ({})", participant.id(), participant.displayName());
        }
    }

    /**
     * 참가자 등록 해제.
     *
     * @return 해제된 참가자 (등록되지 않았으면 empty)
     */
    public Optional<Participant> unregister(ParticipantId id) {
        Participant removed = participants.remove(id);
        if (removed != null) {
            log.info("Unregistered participant {}", id);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Participant> find(ParticipantId id) {
        return Optional.ofNullable(id == null ? null : participants.get(id));
    }

    /**
     * 등록된 참가자 조회.
     *
     * @throws UnknownRecipientException 등록되지 않은 경우
     */
    public Participant require(ParticipantId id) {
        return find(id).orElseThrow(() -> new UnknownRecipientException(id));
    }

    /**
     * 받은편지함이 있는 프로세스 내 참가자 조회.
     *
     * @throws UnknownRecipientException 등록되지 않은 경우
     * @throws IllegalStateException 프로세스 내 참가자가 아닌 경우
     */
    public LocalParticipant requireLocal(ParticipantId id) {
        Participant participant = require(id);
        if (!(participant instanceof LocalParticipant)) {
            throw new IllegalStateException("Participant " + id + " has no local inbox to wait on");
        }
        return (LocalParticipant) participant;
    }

    public boolean contains(ParticipantId id) {
        return id != null && participants.containsKey(id);
    }

    public List<Participant> all() {
        return List.copyOf(participants.values());
    }
}
