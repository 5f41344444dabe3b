package com.ryuqq.parley.core.statemachine;

/**
 * 회의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * FORMING (초대 응답 대기)
 *    │
 *    ├─► ACTIVE (필수 참석자 전원 합류)
 *    │      │
 *    │      └─► ENDED (명시적 종료 또는 마지막 참가자 퇴장)
 *    │
 *    └─► ENDED (소유자가 정족수 전에 종료)
 *
 * 금지된 전이:
 * - ENDED → 어떤 상태로도 ❌
 * - ACTIVE → FORMING ❌
 * </pre>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public enum MeetingState {

    /**
     * 초대가 진행 중이며 필수 참석자를 기다리는 상태.
     */
    FORMING,

    /**
     * 필수 참석자 전원이 합류한 상태.
     */
    ACTIVE,

    /**
     * 종료됨. 이후 참여/퇴장/발언은 거부됩니다.
     */
    ENDED;

    /**
     * 종료 상태인지 확인.
     *
     * @return ENDED인 경우 true
     */
    public boolean isTerminal() {
        return this == ENDED;
    }
}
