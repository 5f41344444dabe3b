package com.ryuqq.parley.core.message;

import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 한 단위의 통신을 나타내는 불변 메시지.
 *
 * <p>1:1 메시지는 {@code recipient}를, 그룹 메시지는 {@code meetingId}와 선택적 명시 대상
 * ({@code targets})을 가집니다. 생성 이후 수정되지 않으며 히스토리에 추가되거나 전달될 뿐입니다.</p>
 *
 * <p><strong>필드 규칙:</strong></p>
 * <ul>
 *   <li>DIRECT: recipient 필수, meetingId 없음</li>
 *   <li>MEETING_BROADCAST: meetingId 필수, recipient 없음</li>
 *   <li>MEETING_INVITATION / MEETING_INVITATION_RESPONSE: recipient와 meetingId 모두 필수</li>
 * </ul>
 *
 * @param id 고유 메시지 ID
 * @param sender 발신자
 * @param recipient 단일 수신자 (그룹 메시지는 null)
 * @param meetingId 회의 문맥 (직접 메시지는 null)
 * @param targets 그룹 메시지의 명시 대상 (없으면 빈 목록)
 * @param content 본문
 * @param type 메시지 유형
 * @param streamId 스트림 ID (스트림이 아니면 null)
 * @param createdAt 생성 시각
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record Message(
    String id,
    ParticipantId sender,
    ParticipantId recipient,
    MeetingId meetingId,
    List<ParticipantId> targets,
    String content,
    MessageType type,
    String streamId,
    Instant createdAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 유형별 필드 규칙을 위반한 경우
     */
    public Message {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (type.requiresMeeting() && meetingId == null) {
            throw new IllegalArgumentException(type + " message requires meetingId");
        }
        if (type != MessageType.MEETING_BROADCAST && recipient == null) {
            throw new IllegalArgumentException(type + " message requires recipient");
        }
        if (type == MessageType.MEETING_BROADCAST && recipient != null) {
            throw new IllegalArgumentException("MEETING_BROADCAST message cannot have a single recipient");
        }
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    /**
     * 1:1 직접 메시지 생성.
     */
    public static Message direct(ParticipantId sender, ParticipantId recipient, String content) {
        return new Message(newId(), sender, recipient, null, List.of(), content,
            MessageType.DIRECT, null, Instant.now());
    }

    /**
     * 회의 브로드캐스트 메시지 생성.
     *
     * @param sender 발신자
     * @param meetingId 회의 ID
     * @param content 본문
     * @param targets 명시 대상 (빈 목록이면 전체 대상)
     * @return Message
     */
    public static Message meetingBroadcast(
        ParticipantId sender,
        MeetingId meetingId,
        String content,
        List<ParticipantId> targets
    ) {
        return new Message(newId(), sender, null, meetingId, targets, content,
            MessageType.MEETING_BROADCAST, null, Instant.now());
    }

    /**
     * 회의 초대 메시지 생성.
     */
    public static Message invitation(ParticipantId inviter, ParticipantId invitee, MeetingId meetingId, String content) {
        return new Message(newId(), inviter, invitee, meetingId, List.of(), content,
            MessageType.MEETING_INVITATION, null, Instant.now());
    }

    /**
     * 초대 응답 메시지 생성.
     */
    public static Message invitationResponse(
        ParticipantId invitee,
        ParticipantId inviter,
        MeetingId meetingId,
        String content
    ) {
        return new Message(newId(), invitee, inviter, meetingId, List.of(), content,
            MessageType.MEETING_INVITATION_RESPONSE, null, Instant.now());
    }

    /**
     * 스트림 ID를 부여한 사본 (메시지 ID와 생성 시각은 유지).
     *
     * @param newStreamId 스트림 ID
     * @return 새 Message
     */
    public Message withStreamId(String newStreamId) {
        return new Message(id, sender, recipient, meetingId, targets, content, type, newStreamId, createdAt);
    }

    /**
     * 사람 참가자가 보낸 메시지인지 확인.
     *
     * @return 발신자가 사람이면 true
     */
    public boolean isFromHuman() {
        return sender.isHuman();
    }

    /**
     * 회의 그룹 채널로 전파되는 메시지인지 확인.
     */
    public boolean isBroadcast() {
        return type == MessageType.MEETING_BROADCAST;
    }

    public boolean hasExplicitTargets() {
        return !targets.isEmpty();
    }

    /**
     * 명시 대상 목록에 포함되는지 확인.
     *
     * @param participant 확인할 참가자
     * @return 명시 대상이면 true
     */
    public boolean targets(ParticipantId participant) {
        return targets.contains(participant);
    }

    public boolean isStreamed() {
        return streamId != null;
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
