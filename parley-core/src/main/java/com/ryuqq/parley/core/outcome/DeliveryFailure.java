package com.ryuqq.parley.core.outcome;

import com.ryuqq.parley.core.model.ParticipantId;

/**
 * 단일 수신자에 대한 전달 실패 기록.
 *
 * @param recipient 전달에 실패한 수신자
 * @param errorCode 오류 코드 (예: DELIVERY-500)
 * @param message 오류 메시지
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record DeliveryFailure(
    ParticipantId recipient,
    String errorCode,
    String message
) {

    public DeliveryFailure {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        message = message == null ? "" : message;
    }
}
