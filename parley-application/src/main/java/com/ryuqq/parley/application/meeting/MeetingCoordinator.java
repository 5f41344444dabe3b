package com.ryuqq.parley.application.meeting;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.outcome.DeliveryReport;
import com.ryuqq.parley.core.outcome.InviteResult;
import com.ryuqq.parley.core.outcome.LeaveResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 회의 생명주기 조정자.
 *
 * <p>회의 생성, 초대, 정족수 대기, 발언, 퇴장, 종료를 담당합니다.
 * 모든 회의 작업은 같은 Channel/Message/Inbox 기반 위에서 동작합니다.</p>
 *
 * <p><strong>상태 흐름:</strong></p>
 * <ol>
 *   <li>{@link #openMeeting}: 회의 ID 할당, 그룹 채널 생성, 초대 발송 (FORMING)</li>
 *   <li>{@link #joinMeeting} / {@link #rejectInvitation}: 초대 대상의 응답</li>
 *   <li>필수 참석자 전원 합류 시 ACTIVE 전이, "회의 시작" 알림</li>
 *   <li>{@link #leaveMeeting} / {@link #endMeeting}: 퇴장 및 종료 (ENDED)</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MeetingId id = coordinator.createMeeting(
 *     owner, "Planning", List.of(agentA, agentB), List.of(), Duration.ofSeconds(30));
 * coordinator.broadcast(id, owner, "Let's plan the release", List.of());
 * </pre>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public interface MeetingCoordinator {

    /**
     * 회의를 열고 초대를 보냄 (대기하지 않음).
     *
     * @param owner 소유자 (생성 시 바로 참여)
     * @param purpose 회의 목적
     * @param required 필수 참석자
     * @param optional 선택 참석자
     * @return 할당된 MeetingId
     * @throws com.ryuqq.parley.core.exception.UnknownRecipientException 등록되지 않은 참가자가 포함된 경우
     */
    MeetingId openMeeting(ParticipantId owner, String purpose, List<ParticipantId> required, List<ParticipantId> optional);

    /**
     * 필수 참석자 전원이 합류할 때까지 대기.
     *
     * <p>폴링하지 않고 정족수 이벤트에서 깨어납니다. 시간 초과는 재시도하지 않고 그대로 전달합니다.</p>
     *
     * @param meetingId 회의 ID
     * @param timeout 최대 대기 시간
     * @return ACTIVE 상태의 스냅샷
     * @throws com.ryuqq.parley.core.exception.MeetingTimeoutException 시간 내 정족수에 도달하지 못한 경우
     * @throws com.ryuqq.parley.core.exception.MeetingEndedException 대기 중 회의가 종료된 경우
     */
    MeetingView awaitQuorum(MeetingId meetingId, Duration timeout);

    /**
     * 회의를 열고 정족수까지 대기.
     *
     * @return 할당된 MeetingId
     * @throws com.ryuqq.parley.core.exception.MeetingTimeoutException 시간 내 정족수에 도달하지 못한 경우
     */
    MeetingId createMeeting(
        ParticipantId owner,
        String purpose,
        List<ParticipantId> required,
        List<ParticipantId> optional,
        Duration timeout
    );

    /**
     * 설정된 기본 정족수 대기 시간으로 회의 생성.
     */
    MeetingId createMeeting(ParticipantId owner, String purpose, List<ParticipantId> required, List<ParticipantId> optional);

    /**
     * 초대 수락.
     *
     * @return 새로 합류했으면 true, 이미 참여 중이면 false
     * @throws com.ryuqq.parley.core.exception.NotMeetingParticipantException 초대받지 않은 경우
     * @throws com.ryuqq.parley.core.exception.MeetingEndedException 회의가 종료된 경우
     */
    boolean joinMeeting(MeetingId meetingId, ParticipantId participant);

    /**
     * 초대 거절.
     *
     * @param reason 거절 이유 (예: busy)
     * @throws com.ryuqq.parley.core.exception.NotMeetingParticipantException 응답 대기 중인 초대가 없는 경우
     */
    void rejectInvitation(MeetingId meetingId, ParticipantId participant, String reason);

    /**
     * 초대 응답 (수락 또는 거절).
     */
    default void respondToInvitation(MeetingId meetingId, ParticipantId participant, boolean accept, String reason) {
        if (accept) {
            joinMeeting(meetingId, participant);
        } else {
            rejectInvitation(meetingId, participant, reason);
        }
    }

    /**
     * 참가자 초대. 이미 참여 중이거나 응답 대기 중이면 아무것도 보내지 않습니다.
     *
     * @param inviter 초대하는 참가자 (참여 중이어야 함)
     * @param invitee 초대 대상
     * @param required 필수 참석자로 초대할지 여부
     * @return 초대 결과
     */
    InviteResult invite(MeetingId meetingId, ParticipantId inviter, ParticipantId invitee, boolean required);

    /**
     * 회의 발언. 그룹 채널로 다른 참여자 전원에게 전달하고 히스토리에 추가합니다.
     *
     * @param targets 명시 대상 (빈 목록이면 지목 없음)
     * @return 전달 결과
     * @throws com.ryuqq.parley.core.exception.NotMeetingParticipantException 참여 중이 아닌 경우
     * @throws com.ryuqq.parley.core.exception.MeetingEndedException 회의가 종료된 경우
     */
    DeliveryReport broadcast(MeetingId meetingId, ParticipantId sender, String content, List<ParticipantId> targets);

    /**
     * 회의 퇴장.
     *
     * <p>여러 명이 참여했던 회의의 마지막 참가자는 바로 종료되지 않고
     * {@link LeaveResult#CONFIRMATION_REQUIRED}를 받습니다.</p>
     *
     * @return 퇴장 결과 (두 번째 호출은 ALREADY_LEFT)
     * @throws com.ryuqq.parley.core.exception.MeetingEndedException 회의가 종료된 경우
     */
    LeaveResult leaveMeeting(MeetingId meetingId, ParticipantId participant);

    /**
     * 확인 여부를 지정한 회의 퇴장. {@code confirmed}이면 마지막 참가자의 퇴장으로 회의가 종료됩니다.
     */
    LeaveResult leaveMeeting(MeetingId meetingId, ParticipantId participant, boolean confirmed);

    /**
     * 회의 종료.
     *
     * @param requester 소유자 또는 참여 중인 참가자
     * @return 이번 호출로 종료되었으면 true, 이미 종료된 경우 false
     * @throws com.ryuqq.parley.core.exception.NotMeetingParticipantException 종료 권한이 없는 경우
     */
    boolean endMeeting(MeetingId meetingId, ParticipantId requester);

    Optional<MeetingView> findMeeting(MeetingId meetingId);

    /**
     * 전체 회의 히스토리.
     */
    List<Message> history(MeetingId meetingId);

    /**
     * 참가자가 아직 읽지 않은 회의 메시지 (읽음 위치는 바꾸지 않음).
     */
    List<Message> unreadFor(MeetingId meetingId, ParticipantId participant);

    /**
     * 참가자의 읽음 위치를 히스토리 끝으로 이동.
     */
    void markRead(MeetingId meetingId, ParticipantId participant);

    Map<String, String> sharedState(MeetingId meetingId);

    /**
     * 공유 상태 갱신. 참여 중인 참가자만 가능합니다.
     */
    void putSharedState(MeetingId meetingId, ParticipantId participant, String key, String value);

    /**
     * 종료되지 않은 회의에 참여 중인지 확인.
     *
     * @return 진행 중인 회의가 있으면 true
     */
    boolean isEngaged(ParticipantId participant);
}
