package com.ryuqq.parley.core.event;

import com.ryuqq.parley.core.model.ParticipantId;

import java.time.Instant;

/**
 * 스트림 조각. 일시적인 표시용이며, 최종 본문은 {@link StreamCompleteEvent}가 기준입니다.
 *
 * @param recipient 점진 표시 수신자
 * @param streamId 스트림 ID
 * @param chunk 조각 텍스트
 * @param sequence 0부터 시작하는 조각 순번
 * @param occurredAt 발생 시각
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record StreamChunkEvent(
    ParticipantId recipient,
    String streamId,
    String chunk,
    int sequence,
    Instant occurredAt
) implements StreamEvent {

    public StreamChunkEvent {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId cannot be null or blank");
        }
        if (chunk == null) {
            throw new IllegalArgumentException("chunk cannot be null");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence cannot be negative");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }
}
