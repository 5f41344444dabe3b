package com.ryuqq.parley.core.outcome;

/**
 * 회의 퇴장 결과.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public enum LeaveResult {

    /**
     * 퇴장 처리됨.
     */
    LEFT,

    /**
     * 이미 퇴장한 상태 (상태 변경 없음).
     */
    ALREADY_LEFT,

    /**
     * 여러 명이 참여했던 회의의 마지막 참가자이므로 종료 확인이 필요함.
     */
    CONFIRMATION_REQUIRED,

    /**
     * 퇴장으로 회의가 종료됨.
     */
    MEETING_ENDED;

    /**
     * 참가자 상태가 바뀌었는지 확인.
     *
     * @return LEFT 또는 MEETING_ENDED이면 true
     */
    public boolean changedState() {
        return this == LEFT || this == MEETING_ENDED;
    }
}
