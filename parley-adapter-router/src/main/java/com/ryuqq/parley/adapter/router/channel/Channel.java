package com.ryuqq.parley.adapter.router.channel;

import com.ryuqq.parley.core.event.MessageDeliveredEvent;
import com.ryuqq.parley.core.exception.DeliveryFailureException;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.outcome.DeliveryFailure;
import com.ryuqq.parley.core.outcome.DeliveryReport;
import com.ryuqq.parley.core.spi.EventBus;
import com.ryuqq.parley.core.spi.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 참가자 집합을 소유하는 라우팅 통로.
 *
 * <p>1:1, 1:N, N:N 통신을 하나의 추상화로 다룹니다. 1:1 채널의 ID는 정렬된 참가자 ID에서,
 * 회의 채널의 ID는 회의 ID에서 결정되며 채널이 살아 있는 동안 바뀌지 않습니다.</p>
 *
 * <p><strong>전달 규칙:</strong></p>
 * <ul>
 *   <li>발신자를 제외한 모든 참가자에게 전달</li>
 *   <li>한 참가자의 실패는 잡아서 기록하고, 나머지 참가자 전달은 계속 진행</li>
 *   <li>실패는 {@link DeliveryReport}의 부분 실패로 호출 측에 반환</li>
 *   <li>성공한 전달마다 {@link MessageDeliveredEvent} 발행</li>
 * </ul>
 *
 * <p>인스턴스는 {@link ChannelRegistry}를 통해서만 생성됩니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class Channel {

    private static final Logger log = LoggerFactory.getLogger(Channel.class);

    private final String id;
    private final MeetingId meetingId;
    private final List<Participant> participants;
    private final Map<String, StreamState> streams = new ConcurrentHashMap<>();
    private final EventBus eventBus;

    Channel(String id, MeetingId meetingId, Collection<? extends Participant> initial, EventBus eventBus) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        this.id = id;
        this.meetingId = meetingId;
        this.participants = new CopyOnWriteArrayList<>();
        this.eventBus = eventBus;
        if (initial != null) {
            initial.forEach(this::addParticipant);
        }
    }

    /**
     * 발신자를 제외한 모든 참가자에게 전달.
     *
     * @param message 전달할 메시지
     * @param senderId 발신자 ID
     * @return 전달 결과
     */
    public DeliveryReport send(Message message, ParticipantId senderId) {
        return send(message, senderId == null ? Set.of() : Set.of(senderId));
    }

    /**
     * 지정한 참가자를 제외한 모든 참가자에게 전달.
     *
     * @param message 전달할 메시지
     * @param excluded 전달하지 않을 참가자
     * @return 전달 결과
     */
    public DeliveryReport send(Message message, Set<ParticipantId> excluded) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        List<ParticipantId> delivered = new ArrayList<>();
        List<DeliveryFailure> failures = new ArrayList<>();
        for (Participant participant : participants) {
            if (excluded.contains(participant.id())) {
                continue;
            }
            try {
                participant.deliver(message);
            } catch (RuntimeException e) {
                log.warn("Delivery of message {} to {} failed on channel {}, continuing fan-out",
                    message.id(), participant.id(), id, e);
                failures.add(new DeliveryFailure(
                    participant.id(), DeliveryFailureException.ERROR_CODE, String.valueOf(e.getMessage())));
                continue;
            }
            delivered.add(participant.id());
            eventBus.publish(new MessageDeliveredEvent(participant.id(), message, id, Instant.now()));
        }
        log.debug("Channel {} delivered {} {} to {} recipient(s), {} failure(s)",
            id, message.type(), message.id(), delivered.size(), failures.size());
        return new DeliveryReport(message.id(), delivered, failures);
    }

    /**
     * 참가자 추가. 같은 ID가 이미 있으면 무시합니다.
     *
     * @return 추가되었으면 true
     */
    public synchronized boolean addParticipant(Participant participant) {
        if (participant == null) {
            throw new IllegalArgumentException("participant cannot be null");
        }
        if (contains(participant.id())) {
            return false;
        }
        participants.add(participant);
        return true;
    }

    /**
     * 참가자 제거.
     *
     * @return 제거되었으면 true
     */
    public synchronized boolean removeParticipant(ParticipantId participantId) {
        return participants.removeIf(p -> p.id().equals(participantId));
    }

    public boolean contains(ParticipantId participantId) {
        for (Participant participant : participants) {
            if (participant.id().equals(participantId)) {
                return true;
            }
        }
        return false;
    }

    public List<Participant> participants() {
        return List.copyOf(participants);
    }

    /**
     * 발신자를 제외한 현재 수신자.
     */
    public List<Participant> recipientsExcluding(ParticipantId senderId) {
        List<Participant> recipients = new ArrayList<>();
        for (Participant participant : participants) {
            if (!participant.id().equals(senderId)) {
                recipients.add(participant);
            }
        }
        return recipients;
    }

    /**
     * 진행 중 스트림 등록.
     *
     * @throws IllegalStateException 같은 ID의 스트림이 이미 있는 경우
     */
    public void openStream(StreamState state) {
        if (streams.putIfAbsent(state.streamId(), state) != null) {
            throw new IllegalStateException("Stream already open on channel " + id + ": " + state.streamId());
        }
    }

    public Optional<StreamState> stream(String streamId) {
        return Optional.ofNullable(streams.get(streamId));
    }

    public void closeStream(String streamId) {
        streams.remove(streamId);
    }

    public int openStreamCount() {
        return streams.size();
    }

    public String id() {
        return id;
    }

    public Optional<MeetingId> meetingId() {
        return Optional.ofNullable(meetingId);
    }

    public boolean isMeetingChannel() {
        return meetingId != null;
    }

    @Override
    public String toString() {
        return "Channel{id=" + id + ", participants=" + participants.size() + "}";
    }
}
