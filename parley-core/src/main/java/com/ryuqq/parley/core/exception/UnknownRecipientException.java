package com.ryuqq.parley.core.exception;

import com.ryuqq.parley.core.model.EntityId;

/**
 * 라우팅 대상이 등록되어 있지 않은 경우.
 *
 * <p>대체 수신자를 추측하지 않고 항상 발신자에게 전달됩니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class UnknownRecipientException extends ParleyException {

    public static final String ERROR_CODE = "ROUTE-404";

    private final EntityId recipient;

    public UnknownRecipientException(EntityId recipient) {
        super(ERROR_CODE, "Unknown recipient: " + recipient);
        this.recipient = recipient;
    }

    public EntityId recipient() {
        return recipient;
    }
}
