package com.ryuqq.parley.core.event;

import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.statemachine.MeetingState;

import java.time.Instant;

/**
 * 회의 상태 전이.
 *
 * @param meetingId 회의 ID
 * @param from 이전 상태
 * @param to 새 상태
 * @param occurredAt 발생 시각
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record MeetingStateChangedEvent(
    MeetingId meetingId,
    MeetingState from,
    MeetingState to,
    Instant occurredAt
) implements ParleyEvent {

    public MeetingStateChangedEvent {
        if (meetingId == null) {
            throw new IllegalArgumentException("meetingId cannot be null");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }
}
