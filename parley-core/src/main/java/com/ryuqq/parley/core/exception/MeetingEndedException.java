package com.ryuqq.parley.core.exception;

import com.ryuqq.parley.core.model.MeetingId;

/**
 * 이미 종료(ENDED)된 회의에 참여/퇴장/발언을 시도한 경우.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class MeetingEndedException extends ParleyException {

    public static final String ERROR_CODE = "MEETING-410";

    private final MeetingId meetingId;

    public MeetingEndedException(MeetingId meetingId, String operation) {
        super(ERROR_CODE, "Meeting " + meetingId.getValue() + " has ended, cannot " + operation);
        this.meetingId = meetingId;
    }

    public MeetingId meetingId() {
        return meetingId;
    }
}
