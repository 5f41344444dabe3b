package com.ryuqq.parley.core.statemachine;

import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;

import java.time.Instant;

/**
 * 회의 초대 스냅샷.
 *
 * <p>불변 레코드이며, 응답 시 {@link #resolve(InvitationStatus, String)}로 새 인스턴스를 만듭니다.
 * PENDING에서만 응답할 수 있습니다.</p>
 *
 * @param meetingId 회의 ID
 * @param inviter 초대한 참가자
 * @param invitee 초대 대상
 * @param required 필수 참석자 여부
 * @param issuedAt 초대 시각
 * @param status 응답 상태
 * @param reason 거절 이유 (거절이 아니면 null)
 * @param respondedAt 응답 시각 (PENDING이면 null)
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record MeetingInvitation(
    MeetingId meetingId,
    ParticipantId inviter,
    ParticipantId invitee,
    boolean required,
    Instant issuedAt,
    InvitationStatus status,
    String reason,
    Instant respondedAt
) {

    public MeetingInvitation {
        if (meetingId == null) {
            throw new IllegalArgumentException("meetingId cannot be null");
        }
        if (inviter == null) {
            throw new IllegalArgumentException("inviter cannot be null");
        }
        if (invitee == null) {
            throw new IllegalArgumentException("invitee cannot be null");
        }
        if (issuedAt == null) {
            throw new IllegalArgumentException("issuedAt cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    /**
     * 새 초대 (PENDING).
     */
    public static MeetingInvitation issue(MeetingId meetingId, ParticipantId inviter, ParticipantId invitee, boolean required) {
        return new MeetingInvitation(meetingId, inviter, invitee, required, Instant.now(),
            InvitationStatus.PENDING, null, null);
    }

    /**
     * 초대 응답 반영.
     *
     * @param response JOINED 또는 REJECTED
     * @param responseReason 거절 이유 (선택)
     * @return 응답이 반영된 새 MeetingInvitation
     * @throws IllegalArgumentException response가 PENDING이거나 null인 경우
     * @throws IllegalStateException 이미 응답한 초대인 경우
     */
    public MeetingInvitation resolve(InvitationStatus response, String responseReason) {
        if (response == null || response == InvitationStatus.PENDING) {
            throw new IllegalArgumentException("response must be JOINED or REJECTED");
        }
        if (status.isResolved()) {
            throw new IllegalStateException("Invitation for " + invitee + " already resolved: " + status);
        }
        return new MeetingInvitation(meetingId, inviter, invitee, required, issuedAt,
            response, responseReason, Instant.now());
    }

    public boolean isPending() {
        return status == InvitationStatus.PENDING;
    }
}
