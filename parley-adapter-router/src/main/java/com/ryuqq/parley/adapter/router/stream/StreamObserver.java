package com.ryuqq.parley.adapter.router.stream;

import com.ryuqq.parley.core.event.StreamChunkEvent;
import com.ryuqq.parley.core.event.StreamCompleteEvent;
import com.ryuqq.parley.core.event.StreamStartEvent;

/**
 * 스트림 단계 관찰자 (예: 표현 계층 브리지).
 *
 * <p>조각은 일시적인 표시용이며, {@link #onComplete(StreamCompleteEvent)}의 최종 메시지가 기준입니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public interface StreamObserver {

    default void onStart(StreamStartEvent event) {
    }

    default void onChunk(StreamChunkEvent event) {
    }

    default void onComplete(StreamCompleteEvent event) {
    }
}
