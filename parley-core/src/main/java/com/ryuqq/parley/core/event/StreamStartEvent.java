package com.ryuqq.parley.core.event;

import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;

import java.time.Instant;

/**
 * 스트림 시작.
 *
 * @param recipient 점진 표시 수신자
 * @param streamId 스트림 ID
 * @param sender 발신자
 * @param meetingId 회의 스트림이면 회의 ID, 아니면 null
 * @param occurredAt 발생 시각
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record StreamStartEvent(
    ParticipantId recipient,
    String streamId,
    ParticipantId sender,
    MeetingId meetingId,
    Instant occurredAt
) implements StreamEvent {

    public StreamStartEvent {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId cannot be null or blank");
        }
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }
}
