package com.ryuqq.parley.adapter.router;

import java.time.Duration;

/**
 * 라우터/회의 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>quorumTimeoutMs: 정족수 대기 기본 시간 (기본 30000ms)</li>
 *   <li>targetedWaitMs: 명시적으로 지목된 메시지가 있을 때의 회의 대기 시간 (기본 500ms)</li>
 *   <li>passiveWaitMs: 지목되지 않았을 때 회의 메시지를 모으는 시간 (기본 5000ms)</li>
 *   <li>directWaitMs: 1:1 메시지 대기 기본 시간 (기본 5000ms)</li>
 *   <li>maxBatchSize: 한 번에 돌려주는 최대 메시지 수 (기본 100)</li>
 *   <li>historyLimit: 회의 히스토리 최대 보관 수 (기본 1000)</li>
 *   <li>firstMeetingNumber: 첫 회의 번호 (기본 100)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>빠른 응답: targetedWaitMs 감소 (500 → 100)</li>
 *   <li>발언 묶음 증가: passiveWaitMs 증가 (5000 → 10000)</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 * @param quorumTimeoutMs 정족수 대기 시간 (밀리초, 양수여야 함)
 * @param targetedWaitMs 지목 시 대기 시간 (밀리초, 0 이상)
 * @param passiveWaitMs 비지목 시 대기 시간 (밀리초, targetedWaitMs 이상)
 * @param directWaitMs 1:1 대기 시간 (밀리초, 0 이상)
 * @param maxBatchSize 최대 배치 크기 (1 이상)
 * @param historyLimit 히스토리 보관 수 (1 이상)
 * @param firstMeetingNumber 첫 회의 번호 (0 이상)
 */
public record ParleyConfig(
    long quorumTimeoutMs,
    long targetedWaitMs,
    long passiveWaitMs,
    long directWaitMs,
    int maxBatchSize,
    int historyLimit,
    long firstMeetingNumber
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: quorumTimeoutMs=30000ms, targetedWaitMs=500ms, passiveWaitMs=5000ms,
     * directWaitMs=5000ms, maxBatchSize=100, historyLimit=1000, firstMeetingNumber=100</p>
     */
    public ParleyConfig() {
        this(30_000, 500, 5_000, 5_000, 100, 1_000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ParleyConfig {
        if (quorumTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "quorumTimeoutMs must be positive (current: " + quorumTimeoutMs + ")"
            );
        }
        if (targetedWaitMs < 0) {
            throw new IllegalArgumentException(
                "targetedWaitMs cannot be negative (current: " + targetedWaitMs + ")"
            );
        }
        if (passiveWaitMs < targetedWaitMs) {
            throw new IllegalArgumentException(
                "passiveWaitMs must be >= targetedWaitMs (current: " + passiveWaitMs + ")"
            );
        }
        if (directWaitMs < 0) {
            throw new IllegalArgumentException(
                "directWaitMs cannot be negative (current: " + directWaitMs + ")"
            );
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException(
                "maxBatchSize must be positive (current: " + maxBatchSize + ")"
            );
        }
        if (historyLimit <= 0) {
            throw new IllegalArgumentException(
                "historyLimit must be positive (current: " + historyLimit + ")"
            );
        }
        if (firstMeetingNumber < 0) {
            throw new IllegalArgumentException(
                "firstMeetingNumber cannot be negative (current: " + firstMeetingNumber + ")"
            );
        }
    }

    public Duration quorumTimeout() {
        return Duration.ofMillis(quorumTimeoutMs);
    }

    public Duration targetedWait() {
        return Duration.ofMillis(targetedWaitMs);
    }

    public Duration passiveWait() {
        return Duration.ofMillis(passiveWaitMs);
    }

    public Duration directWait() {
        return Duration.ofMillis(directWaitMs);
    }

    /**
     * quorumTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public ParleyConfig withQuorumTimeoutMs(long quorumTimeoutMs) {
        return new ParleyConfig(quorumTimeoutMs, targetedWaitMs, passiveWaitMs, directWaitMs,
            maxBatchSize, historyLimit, firstMeetingNumber);
    }

    /**
     * targetedWaitMs와 passiveWaitMs를 변경한 새 인스턴스 생성.
     */
    public ParleyConfig withWaitWindows(long targetedWaitMs, long passiveWaitMs) {
        return new ParleyConfig(quorumTimeoutMs, targetedWaitMs, passiveWaitMs, directWaitMs,
            maxBatchSize, historyLimit, firstMeetingNumber);
    }

    /**
     * directWaitMs만 변경한 새 인스턴스 생성.
     */
    public ParleyConfig withDirectWaitMs(long directWaitMs) {
        return new ParleyConfig(quorumTimeoutMs, targetedWaitMs, passiveWaitMs, directWaitMs,
            maxBatchSize, historyLimit, firstMeetingNumber);
    }

    /**
     * maxBatchSize만 변경한 새 인스턴스 생성.
     */
    public ParleyConfig withMaxBatchSize(int maxBatchSize) {
        return new ParleyConfig(quorumTimeoutMs, targetedWaitMs, passiveWaitMs, directWaitMs,
            maxBatchSize, historyLimit, firstMeetingNumber);
    }

    /**
     * historyLimit만 변경한 새 인스턴스 생성.
     */
    public ParleyConfig withHistoryLimit(int historyLimit) {
        return new ParleyConfig(quorumTimeoutMs, targetedWaitMs, passiveWaitMs, directWaitMs,
            maxBatchSize, historyLimit, firstMeetingNumber);
    }

    /**
     * firstMeetingNumber만 변경한 새 인스턴스 생성.
     */
    public ParleyConfig withFirstMeetingNumber(long firstMeetingNumber) {
        return new ParleyConfig(quorumTimeoutMs, targetedWaitMs, passiveWaitMs, directWaitMs,
            maxBatchSize, historyLimit, firstMeetingNumber);
    }
}
