package com.ryuqq.parley.core.outcome;

/**
 * 회의 초대 결과.
 *
 * <p>이미 참여했거나 응답 대기 중인 참가자에 대한 초대는 멱등이며, 초대 메시지를 다시 보내지 않습니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public enum InviteResult {

    INVITED,

    ALREADY_JOINED,

    ALREADY_PENDING;

    public boolean isNewInvitation() {
        return this == INVITED;
    }
}
