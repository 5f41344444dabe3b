package com.ryuqq.parley.core.event;

/**
 * 스트림 단계(start, chunk, complete) 이벤트.
 *
 * <p>스트림 이벤트는 점진 표시가 가능한 수신자마다 한 건씩 발행됩니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public sealed interface StreamEvent extends AddressedEvent
    permits StreamStartEvent, StreamChunkEvent, StreamCompleteEvent {

    /**
     * 스트림 ID.
     *
     * @return 스트림 ID
     */
    String streamId();
}
