package com.ryuqq.parley.core.event;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.ParticipantId;

import java.time.Instant;

/**
 * 스트림 완료. 누적된 전체 본문을 정확히 한 번 담습니다.
 *
 * @param recipient 점진 표시 수신자
 * @param streamId 스트림 ID
 * @param finalMessage 전체 본문을 담은 최종 메시지
 * @param occurredAt 발생 시각
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record StreamCompleteEvent(
    ParticipantId recipient,
    String streamId,
    Message finalMessage,
    Instant occurredAt
) implements StreamEvent {

    public StreamCompleteEvent {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId cannot be null or blank");
        }
        if (finalMessage == null) {
            throw new IllegalArgumentException("finalMessage cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }

    public String content() {
        return finalMessage.content();
    }
}
