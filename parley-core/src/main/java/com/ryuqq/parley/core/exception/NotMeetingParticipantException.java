package com.ryuqq.parley.core.exception;

import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;

/**
 * 회의 참가자(또는 초대 대상)가 아닌 참가자가 회의 작업을 요청한 경우.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class NotMeetingParticipantException extends ParleyException {

    public static final String ERROR_CODE = "MEETING-403";

    private final MeetingId meetingId;
    private final ParticipantId participant;

    public NotMeetingParticipantException(MeetingId meetingId, ParticipantId participant, String operation) {
        super(ERROR_CODE, participant + " is not allowed to " + operation + " in meeting " + meetingId.getValue());
        this.meetingId = meetingId;
        this.participant = participant;
    }

    public MeetingId meetingId() {
        return meetingId;
    }

    public ParticipantId participant() {
        return participant;
    }
}
