package com.ryuqq.parley.core.event;

import com.ryuqq.parley.core.model.ParticipantId;

/**
 * 특정 수신자를 위한 이벤트.
 *
 * <p>표현 계층이 뷰어별로 필터링할 수 있도록 대상 수신자 ID를 항상 담습니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public interface AddressedEvent extends ParleyEvent {

    /**
     * 이벤트의 대상 수신자.
     *
     * @return 수신자 ID
     */
    ParticipantId recipient();
}
