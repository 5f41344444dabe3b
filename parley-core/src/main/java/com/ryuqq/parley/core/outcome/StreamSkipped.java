package com.ryuqq.parley.core.outcome;

/**
 * 점진 표시가 가능한 수신자가 없어 스트림을 열지 않음.
 *
 * @param streamId 스트림 ID (chunk/complete 호출에 그대로 사용)
 * @param reason 건너뛴 이유
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record StreamSkipped(String streamId, String reason) implements StreamStartResult {

    public StreamSkipped {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId cannot be null or blank");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
