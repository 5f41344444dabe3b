package com.ryuqq.parley.application.meeting;

import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.statemachine.MeetingInvitation;
import com.ryuqq.parley.core.statemachine.MeetingState;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 회의 상태 스냅샷.
 *
 * <p>조회 시점의 복사본이며, 이후 회의가 바뀌어도 이 값은 변하지 않습니다.</p>
 *
 * @param id 회의 ID
 * @param owner 소유자
 * @param purpose 회의 목적
 * @param state 상태
 * @param required 필수 참석자 (소유자 제외)
 * @param optional 선택 참석자
 * @param joined 현재 참여 중인 참가자 (참여 순서)
 * @param invitations 초대 대상별 초대 상태
 * @param historySize 누적 메시지 수
 * @param sharedState 공유 상태
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record MeetingView(
    MeetingId id,
    ParticipantId owner,
    String purpose,
    MeetingState state,
    List<ParticipantId> required,
    List<ParticipantId> optional,
    List<ParticipantId> joined,
    Map<ParticipantId, MeetingInvitation> invitations,
    int historySize,
    Map<String, String> sharedState
) {

    public MeetingView {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        required = required == null ? List.of() : List.copyOf(required);
        optional = optional == null ? List.of() : List.copyOf(optional);
        joined = joined == null ? List.of() : List.copyOf(joined);
        invitations = invitations == null ? Map.of() : Map.copyOf(invitations);
        sharedState = sharedState == null ? Map.of() : Map.copyOf(sharedState);
    }

    /**
     * 아직 합류하지 않은 필수 참석자.
     *
     * @return 필수 참석자 순서의 목록
     */
    public List<ParticipantId> missingRequired() {
        return required.stream()
            .filter(p -> !joined.contains(p))
            .collect(Collectors.toList());
    }

    public boolean isJoined(ParticipantId participant) {
        return joined.contains(participant);
    }
}
