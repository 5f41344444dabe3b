package com.ryuqq.parley.core.outcome;

import com.ryuqq.parley.core.model.ParticipantId;

import java.util.List;

/**
 * 스트림이 열림.
 *
 * @param streamId 스트림 ID
 * @param streamingRecipients 점진 표시를 받는 수신자
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record StreamStarted(String streamId, List<ParticipantId> streamingRecipients) implements StreamStartResult {

    public StreamStarted {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId cannot be null or blank");
        }
        if (streamingRecipients == null || streamingRecipients.isEmpty()) {
            throw new IllegalArgumentException("streamingRecipients cannot be null or empty");
        }
        streamingRecipients = List.copyOf(streamingRecipients);
    }
}
