package com.ryuqq.parley.core.outcome;

import com.ryuqq.parley.core.model.ParticipantId;

import java.util.ArrayList;
import java.util.List;

/**
 * 팬아웃 전달 결과.
 *
 * <p>한 수신자의 실패는 나머지 수신자 전달을 막지 않습니다. 실패는 예외로 던지지 않고
 * 이 결과에 부분 실패로 기록되어 호출 측에 반환됩니다.</p>
 *
 * @param messageId 전달한 메시지 ID
 * @param delivered 전달에 성공한 수신자 (전달 순서)
 * @param failures 전달에 실패한 수신자
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record DeliveryReport(
    String messageId,
    List<ParticipantId> delivered,
    List<DeliveryFailure> failures
) {

    public DeliveryReport {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId cannot be null or blank");
        }
        delivered = delivered == null ? List.of() : List.copyOf(delivered);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * 수신자 없이 끝난 전달 (예: 채널에 발신자만 있는 경우).
     */
    public static DeliveryReport empty(String messageId) {
        return new DeliveryReport(messageId, List.of(), List.of());
    }

    /**
     * 실패 없이 모든 수신자에게 전달되었는지 확인.
     *
     * @return 실패가 없으면 true
     */
    public boolean isComplete() {
        return failures.isEmpty();
    }

    /**
     * 일부는 성공하고 일부는 실패했는지 확인.
     *
     * @return 부분 실패이면 true
     */
    public boolean isPartialFailure() {
        return !delivered.isEmpty() && !failures.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int recipientCount() {
        return delivered.size() + failures.size();
    }

    /**
     * 다른 결과와 합친 새 결과 (메시지 ID는 이 결과의 것을 유지).
     *
     * @param other 합칠 결과
     * @return 합쳐진 DeliveryReport
     */
    public DeliveryReport merge(DeliveryReport other) {
        List<ParticipantId> mergedDelivered = new ArrayList<>(delivered);
        mergedDelivered.addAll(other.delivered);
        List<DeliveryFailure> mergedFailures = new ArrayList<>(failures);
        mergedFailures.addAll(other.failures);
        return new DeliveryReport(messageId, mergedDelivered, mergedFailures);
    }
}
