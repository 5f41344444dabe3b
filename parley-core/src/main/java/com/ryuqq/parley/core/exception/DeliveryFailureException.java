package com.ryuqq.parley.core.exception;

import com.ryuqq.parley.core.model.ParticipantId;

/**
 * 단일 수신자에 대한 전달 실패.
 *
 * <p>팬아웃 중에는 던져지지 않고 {@link com.ryuqq.parley.core.outcome.DeliveryReport}에
 * 기록됩니다. 직접 전달(예: 회의 종료 확인 요청) 실패를 호출 측에 알릴 때만 던집니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class DeliveryFailureException extends ParleyException {

    public static final String ERROR_CODE = "DELIVERY-500";

    private final ParticipantId recipient;

    public DeliveryFailureException(ParticipantId recipient, Throwable cause) {
        super(ERROR_CODE, "Delivery to " + recipient + " failed: " + cause.getMessage(), cause);
        this.recipient = recipient;
    }

    public ParticipantId recipient() {
        return recipient;
    }
}
