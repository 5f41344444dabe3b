package com.ryuqq.parley.core.exception;

import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;

import java.util.List;

/**
 * 제한 시간 안에 필수 참석자 전원이 합류하지 않은 경우.
 *
 * <p>코어는 재시도하지 않습니다. 늦게 합류하는 참석자를 다시 기다릴지는 호출 측이 결정합니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class MeetingTimeoutException extends ParleyException {

    public static final String ERROR_CODE = "MEETING-408";

    private final MeetingId meetingId;
    private final List<ParticipantId> missingAttendees;

    public MeetingTimeoutException(MeetingId meetingId, List<ParticipantId> missingAttendees, long timeoutMs) {
        super(ERROR_CODE, "Meeting " + meetingId.getValue() + " did not reach quorum within "
            + timeoutMs + "ms, missing required attendees: " + missingAttendees);
        this.meetingId = meetingId;
        this.missingAttendees = List.copyOf(missingAttendees);
    }

    public MeetingId meetingId() {
        return meetingId;
    }

    /**
     * 아직 합류하지 않은 필수 참석자.
     *
     * @return 불변 목록
     */
    public List<ParticipantId> missingAttendees() {
        return missingAttendees;
    }
}
