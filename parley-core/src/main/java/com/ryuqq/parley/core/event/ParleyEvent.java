package com.ryuqq.parley.core.event;

import java.time.Instant;

/**
 * 프로세스 전역 이벤트 버스로 발행되는 모든 이벤트의 상위 타입.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public interface ParleyEvent {

    /**
     * 이벤트 발생 시각.
     *
     * @return 발생 시각
     */
    Instant occurredAt();
}
