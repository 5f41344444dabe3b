package com.ryuqq.parley.adapter.router.participant;

/**
 * 사람 참가자의 회의 스트림 수신 수준.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public enum MeetingNotifications {

    /**
     * 모든 회의 발언을 점진 표시.
     */
    ALL,

    /**
     * 자신을 지목한 발언만 점진 표시.
     */
    TARGETED,

    /**
     * 회의 발언을 점진 표시하지 않음 (최종 메시지는 그대로 전달).
     */
    NONE
}
