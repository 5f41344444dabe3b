package com.ryuqq.parley.core.message;

/**
 * 메시지 유형 태그.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public enum MessageType {

    /**
     * 1:1 직접 메시지.
     */
    DIRECT,

    /**
     * 회의 그룹 채널로 전파되는 메시지.
     */
    MEETING_BROADCAST,

    /**
     * 회의 초대 (초대 대상의 1:1 채널로 전달).
     */
    MEETING_INVITATION,

    /**
     * 초대에 대한 응답 (수락 또는 거절).
     */
    MEETING_INVITATION_RESPONSE;

    /**
     * 회의 문맥을 필수로 갖는 유형인지 확인.
     *
     * @return DIRECT가 아니면 true
     */
    public boolean requiresMeeting() {
        return this != DIRECT;
    }
}
