package com.ryuqq.parley.core.event;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.ParticipantId;

import java.time.Instant;

/**
 * 메시지가 한 수신자에게 전달됨.
 *
 * <p>전사(transcript)나 감사 기록은 이 이벤트의 구독자로 구현합니다.</p>
 *
 * @param recipient 수신자
 * @param message 전달된 메시지
 * @param channelId 전달에 사용된 채널 ID
 * @param occurredAt 발생 시각
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record MessageDeliveredEvent(
    ParticipantId recipient,
    Message message,
    String channelId,
    Instant occurredAt
) implements AddressedEvent {

    public MessageDeliveredEvent {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }
}
