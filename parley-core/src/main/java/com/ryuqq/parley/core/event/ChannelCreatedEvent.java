package com.ryuqq.parley.core.event;

import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;

import java.time.Instant;
import java.util.List;

/**
 * 채널이 새로 생성됨. 같은 채널에 대해 정확히 한 번 발행됩니다.
 *
 * @param channelId 채널 ID
 * @param participants 생성 시점의 참가자
 * @param meetingId 회의 채널이면 회의 ID, 1:1 채널이면 null
 * @param occurredAt 발생 시각
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record ChannelCreatedEvent(
    String channelId,
    List<ParticipantId> participants,
    MeetingId meetingId,
    Instant occurredAt
) implements ParleyEvent {

    public ChannelCreatedEvent {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId cannot be null or blank");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    public boolean isMeetingChannel() {
        return meetingId != null;
    }
}
