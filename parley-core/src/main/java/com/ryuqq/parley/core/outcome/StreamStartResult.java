package com.ryuqq.parley.core.outcome;

/**
 * 스트림 시작 결과.
 *
 * <p>"의도적으로 건너뜀"과 "실패"를 빈 반환값으로 구분하지 않도록 명시적 결과를 반환합니다.
 * 실패는 {@link com.ryuqq.parley.core.exception.ParleyException}으로 전달됩니다.</p>
 * <ul>
 *   <li>{@link StreamStarted}: 점진 표시가 가능한 수신자가 있어 스트림이 열림</li>
 *   <li>{@link StreamSkipped}: 가능한 수신자가 없어 일반 메시지 한 건으로 대체됨</li>
 * </ul>
 *
 * <p>건너뛴 경우에도 같은 streamId로 chunk/complete를 호출할 수 있으며, complete 시점에
 * 누적된 본문이 일반 메시지로 한 번 전달됩니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public sealed interface StreamStartResult permits StreamStarted, StreamSkipped {

    /**
     * 스트림 ID.
     *
     * @return 스트림 ID
     */
    String streamId();

    /**
     * 스트림이 실제로 열렸는지 확인.
     *
     * @return 열렸으면 true
     */
    default boolean isStarted() {
        return this instanceof StreamStarted;
    }
}
