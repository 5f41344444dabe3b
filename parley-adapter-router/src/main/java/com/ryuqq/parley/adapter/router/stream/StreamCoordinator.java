package com.ryuqq.parley.adapter.router.stream;

import com.ryuqq.parley.adapter.router.channel.Channel;
import com.ryuqq.parley.adapter.router.channel.StreamState;
import com.ryuqq.parley.core.event.StreamChunkEvent;
import com.ryuqq.parley.core.event.StreamCompleteEvent;
import com.ryuqq.parley.core.event.StreamEvent;
import com.ryuqq.parley.core.event.StreamStartEvent;
import com.ryuqq.parley.core.exception.StreamProtocolException;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.outcome.DeliveryReport;
import com.ryuqq.parley.core.outcome.StreamSkipped;
import com.ryuqq.parley.core.outcome.StreamStarted;
import com.ryuqq.parley.core.outcome.StreamStartResult;
import com.ryuqq.parley.core.spi.EventBus;
import com.ryuqq.parley.core.spi.Participant;
import com.ryuqq.parley.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 채널 위에서 동작하는 스트림 조정자.
 *
 * <p><strong>단계:</strong></p>
 * <ol>
 *   <li>start: 점진 표시가 가능한 수신자가 있으면 {@link StreamStarted}, 없으면 {@link StreamSkipped}</li>
 *   <li>chunk: 서버 쪽에 누적하고, 점진 표시 수신자마다 {@link StreamChunkEvent} 발행</li>
 *   <li>complete: 누적 본문 전체를 최종 메시지로 한 번 전달하고 {@link StreamCompleteEvent} 발행</li>
 * </ol>
 *
 * <p>건너뛴 스트림도 chunk/complete 호출을 그대로 받으며, 이벤트 없이 누적만 한 뒤 완료 시
 * 스트림 ID가 없는 일반 메시지 한 건으로 전달합니다. 따라서 수신자가 받는 본문은 점진 표시
 * 수신자가 complete 이벤트로 받는 본문과 같습니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class StreamCoordinator {

    private static final Logger log = LoggerFactory.getLogger(StreamCoordinator.class);

    static final String SKIP_REASON = "no recipient supports incremental display";

    private final EventBus eventBus;
    private final Map<String, Channel> openStreams = new ConcurrentHashMap<>();

    public StreamCoordinator(EventBus eventBus) {
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        this.eventBus = eventBus;
    }

    /**
     * 채널의 현재 참가자를 대상으로 스트림 시작.
     *
     * @param channel 전달 채널
     * @param template 최종 메시지 원형 (발신자, 유형, 회의 문맥, 명시 대상)
     * @param streamFilter 점진 표시 가능 수신자 중 실제로 스트림을 받을 수신자
     * @param finalDelivery 완료 시 최종 메시지 전달 함수
     * @return 시작 또는 건너뜀 결과
     */
    public StreamStartResult startStream(
        Channel channel,
        Message template,
        Predicate<Participant> streamFilter,
        Function<Message, DeliveryReport> finalDelivery
    ) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        if (streamFilter == null) {
            throw new IllegalArgumentException("streamFilter cannot be null");
        }
        String streamId = UUID.randomUUID().toString();
        List<ParticipantId> streaming = new ArrayList<>();
        for (Participant recipient : channel.recipientsExcluding(template.sender())) {
            if (recipient.supportsIncrementalDisplay() && streamFilter.test(recipient)) {
                streaming.add(recipient.id());
            }
        }

        StreamState state = new StreamState(streamId, template, streaming, finalDelivery);
        channel.openStream(state);
        openStreams.put(streamId, channel);

        if (streaming.isEmpty()) {
            log.debug("Stream {} on {} skipped: {}", streamId, channel.id(), SKIP_REASON);
            return new StreamSkipped(streamId, SKIP_REASON);
        }
        Instant now = Instant.now();
        for (ParticipantId recipient : streaming) {
            eventBus.publish(new StreamStartEvent(recipient, streamId, template.sender(), template.meetingId(), now));
        }
        log.debug("Stream {} on {} started for {}", streamId, channel.id(), streaming);
        return new StreamStarted(streamId, streaming);
    }

    /**
     * 조각 추가.
     *
     * @throws StreamProtocolException 시작되지 않았거나 이미 완료된 스트림인 경우
     */
    public void streamChunk(String streamId, String chunk) {
        if (chunk == null) {
            throw new IllegalArgumentException("chunk cannot be null");
        }
        StreamState state = require(streamId, "chunk");
        int sequence = state.append(chunk);
        if (state.isStreaming()) {
            Instant now = Instant.now();
            for (ParticipantId recipient : state.streamingRecipients()) {
                eventBus.publish(new StreamChunkEvent(recipient, streamId, chunk, sequence, now));
            }
        }
    }

    /**
     * 스트림 완료.
     *
     * <p>스트림을 받던 수신자에게는 최종 메시지 전달이 실패해도 완료 이벤트가 한 번 발행됩니다.
     * 예를 들어 스트림 도중 회의가 종료되면 완료 이벤트를 발행한 뒤 전달 예외를 그대로 던집니다.</p>
     *
     * @return 최종 메시지 전달 결과
     * @throws StreamProtocolException 시작되지 않았거나 이미 완료된 스트림인 경우
     */
    public DeliveryReport completeStream(String streamId) {
        StreamState state = require(streamId, "complete");
        String content = state.complete();
        Channel channel = openStreams.remove(streamId);
        if (channel != null) {
            channel.closeStream(streamId);
        }

        Message template = state.template();
        Message finalMessage = new Message(
            template.id(),
            template.sender(),
            template.recipient(),
            template.meetingId(),
            template.targets(),
            content,
            template.type(),
            state.isStreaming() ? streamId : null,
            template.createdAt()
        );
        try {
            DeliveryReport report = state.deliverFinal(finalMessage);
            log.debug("Stream {} completed with {} char(s)", streamId, content.length());
            return report;
        } catch (RuntimeException e) {
            log.warn("Stream {} final message was not delivered: {}", streamId, e.getMessage());
            throw e;
        } finally {
            if (state.isStreaming()) {
                Instant now = Instant.now();
                for (ParticipantId recipient : state.streamingRecipients()) {
                    eventBus.publish(new StreamCompleteEvent(recipient, streamId, finalMessage, now));
                }
            }
        }
    }

    /**
     * 스트림 이벤트 관찰.
     *
     * @param viewer 관찰할 수신자 (null이면 모든 수신자)
     * @param observer 관찰자
     * @return 구독 핸들
     */
    public Subscription observe(ParticipantId viewer, StreamObserver observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        return eventBus.subscribe(StreamEvent.class, event -> {
            if (viewer != null && !viewer.equals(event.recipient())) {
                return;
            }
            if (event instanceof StreamStartEvent) {
                observer.onStart((StreamStartEvent) event);
            } else if (event instanceof StreamChunkEvent) {
                observer.onChunk((StreamChunkEvent) event);
            } else if (event instanceof StreamCompleteEvent) {
                observer.onComplete((StreamCompleteEvent) event);
            }
        });
    }

    public boolean isOpen(String streamId) {
        return streamId != null && openStreams.containsKey(streamId);
    }

    private StreamState require(String streamId, String phase) {
        if (streamId == null) {
            throw new StreamProtocolException("null", phase + " without a started stream");
        }
        Channel channel = openStreams.get(streamId);
        if (channel == null) {
            throw new StreamProtocolException(streamId, phase + " without a started stream or after complete");
        }
        return channel.stream(streamId)
            .orElseThrow(() -> new StreamProtocolException(streamId, phase + " on a closed stream"));
    }
}
