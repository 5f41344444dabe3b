package com.ryuqq.parley.core.statemachine;

/**
 * 초대 응답 상태.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public enum InvitationStatus {

    PENDING,

    JOINED,

    REJECTED;

    public boolean isResolved() {
        return this != PENDING;
    }
}
