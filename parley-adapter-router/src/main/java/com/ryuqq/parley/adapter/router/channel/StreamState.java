package com.ryuqq.parley.adapter.router.channel;

import com.ryuqq.parley.core.exception.StreamProtocolException;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.outcome.DeliveryReport;

import java.util.List;
import java.util.function.Function;

/**
 * 채널에 걸린 진행 중 스트림 하나의 상태.
 *
 * <p>조각은 서버 쪽에서 누적되며, 완료 시 누적된 본문 전체가 최종 메시지로 한 번 전달됩니다.
 * 완료 이후의 조각이나 두 번째 완료는 {@link StreamProtocolException}입니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class StreamState {

    private final String streamId;
    private final Message template;
    private final List<ParticipantId> streamingRecipients;
    private final Function<Message, DeliveryReport> finalDelivery;
    private final StringBuilder content = new StringBuilder();
    private int nextSequence;
    private boolean completed;

    /**
     * @param streamId 스트림 ID
     * @param template 최종 메시지의 원형 (본문은 완료 시 채워짐)
     * @param streamingRecipients 점진 표시 수신자 (비어 있으면 건너뛴 스트림)
     * @param finalDelivery 최종 메시지 전달 함수
     */
    public StreamState(
        String streamId,
        Message template,
        List<ParticipantId> streamingRecipients,
        Function<Message, DeliveryReport> finalDelivery
    ) {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId cannot be null or blank");
        }
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        if (finalDelivery == null) {
            throw new IllegalArgumentException("finalDelivery cannot be null");
        }
        this.streamId = streamId;
        this.template = template;
        this.streamingRecipients = streamingRecipients == null ? List.of() : List.copyOf(streamingRecipients);
        this.finalDelivery = finalDelivery;
    }

    public String streamId() {
        return streamId;
    }

    public ParticipantId sender() {
        return template.sender();
    }

    public Message template() {
        return template;
    }

    public List<ParticipantId> streamingRecipients() {
        return streamingRecipients;
    }

    /**
     * 점진 표시 수신자가 있는지 확인.
     */
    public boolean isStreaming() {
        return !streamingRecipients.isEmpty();
    }

    /**
     * 조각 누적.
     *
     * @param chunk 조각 텍스트
     * @return 조각 순번 (0부터)
     * @throws StreamProtocolException 이미 완료된 스트림인 경우
     */
    public synchronized int append(String chunk) {
        if (completed) {
            throw new StreamProtocolException(streamId, "chunk after complete");
        }
        content.append(chunk);
        return nextSequence++;
    }

    /**
     * 스트림 완료 처리.
     *
     * @return 누적된 전체 본문
     * @throws StreamProtocolException 이미 완료된 스트림인 경우
     */
    public synchronized String complete() {
        if (completed) {
            throw new StreamProtocolException(streamId, "already completed");
        }
        completed = true;
        return content.toString();
    }

    public synchronized boolean isCompleted() {
        return completed;
    }

    /**
     * 최종 메시지 전달.
     */
    public DeliveryReport deliverFinal(Message finalMessage) {
        return finalDelivery.apply(finalMessage);
    }
}
