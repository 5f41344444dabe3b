package com.ryuqq.parley.core.model;

import java.util.List;

/**
 * 파싱된 수신자 지정.
 *
 * <p>목적지는 단일 참가자 또는 회의입니다. 회의 목적지에는 명시 대상 목록이 붙을 수 있으며,
 * 명시 대상은 차등 대기 정책의 권위 있는 신호로 사용됩니다.</p>
 *
 * @param destination 목적지 (ParticipantId 또는 MeetingId)
 * @param targets 회의 내 명시 대상 (참가자 목적지이면 빈 목록)
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record RecipientSpec(EntityId destination, List<ParticipantId> targets) {

    public RecipientSpec {
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
        targets = targets == null ? List.of() : List.copyOf(targets);
        if (!(destination instanceof MeetingId) && !targets.isEmpty()) {
            throw new IllegalArgumentException("targets are only allowed for a meeting destination");
        }
    }

    public static RecipientSpec participant(ParticipantId participant) {
        return new RecipientSpec(participant, List.of());
    }

    public static RecipientSpec meeting(MeetingId meetingId, List<ParticipantId> targets) {
        return new RecipientSpec(meetingId, targets);
    }

    public boolean isMeeting() {
        return destination instanceof MeetingId;
    }

    /**
     * 회의 목적지 조회.
     *
     * @return MeetingId
     * @throws IllegalStateException 참가자 목적지인 경우
     */
    public MeetingId meetingId() {
        if (!isMeeting()) {
            throw new IllegalStateException("Recipient is not a meeting: " + destination);
        }
        return (MeetingId) destination;
    }

    /**
     * 참가자 목적지 조회.
     *
     * @return ParticipantId
     * @throws IllegalStateException 회의 목적지인 경우
     */
    public ParticipantId participantId() {
        if (isMeeting()) {
            throw new IllegalStateException("Recipient is a meeting: " + destination);
        }
        return (ParticipantId) destination;
    }
}
