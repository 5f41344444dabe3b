package com.ryuqq.parley.adapter.router;

import com.ryuqq.parley.adapter.router.participant.AddressingRules;
import com.ryuqq.parley.adapter.router.participant.LocalParticipant;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.SourceSpec;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 차등 대기 정책.
 *
 * <p><strong>회의 출처 대기:</strong></p>
 * <ul>
 *   <li>버퍼에 이 참가자를 지목한 회의 메시지가 있으면 짧은 창 ({@link ParleyConfig#targetedWaitMs()})</li>
 *   <li>없으면 여러 발언을 모으는 긴 창 ({@link ParleyConfig#passiveWaitMs()})</li>
 *   <li>창이 끝나거나 배치가 가득 차면 반환</li>
 * </ul>
 *
 * <p><strong>그 밖의 출처:</strong> 일치하는 메시지 한 건이면 바로 반환합니다.</p>
 *
 * <p>어느 경우든 사람이 보낸 메시지는 창을 기다리지 않고 즉시 반환됩니다.
 * 호출 측이 준 시간 제한이 있으면 창은 그보다 길어지지 않습니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
final class WaitPolicy {

    private final ParleyConfig config;

    WaitPolicy(ParleyConfig config) {
        this.config = config;
    }

    /**
     * 이번 대기의 조건 계산.
     *
     * @param participant 대기하는 참가자
     * @param source 출처 필터
     * @param timeout 호출 측 시간 제한 (null이면 설정값)
     * @return 대기 조건
     */
    Window windowFor(LocalParticipant participant, SourceSpec source, Duration timeout) {
        Predicate<Message> filter = source::matches;
        if (source.meetingId().isEmpty()) {
            Duration wait = timeout != null ? timeout : config.directWait();
            return new Window(filter, wait, 1, config.maxBatchSize(), false);
        }
        boolean targeted = participant.inbox()
            .peek(m -> source.matches(m) && AddressingRules.isAddressedTo(m, participant))
            .isPresent();
        Duration wait = targeted ? config.targetedWait() : config.passiveWait();
        if (timeout != null && timeout.compareTo(wait) < 0) {
            wait = timeout;
        }
        return new Window(filter, wait, config.maxBatchSize(), config.maxBatchSize(), targeted);
    }

    /**
     * 한 번의 대기 조건.
     *
     * @param filter 출처 필터
     * @param waitTime 대기 시간
     * @param minItems 조기 반환 최소 건수
     * @param maxItems 최대 반환 건수
     * @param targeted 지목된 메시지 때문에 짧은 창을 골랐는지
     */
    record Window(Predicate<Message> filter, Duration waitTime, int minItems, int maxItems, boolean targeted) {
    }
}
