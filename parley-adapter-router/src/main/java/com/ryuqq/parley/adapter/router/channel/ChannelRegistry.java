package com.ryuqq.parley.adapter.router.channel;

import com.ryuqq.parley.core.event.ChannelCreatedEvent;
import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.spi.EventBus;
import com.ryuqq.parley.core.spi.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 채널 레지스트리.
 *
 * <p>새 채널이 만들어지는 유일한 곳입니다. 생성은 채널 ID를 키로 한
 * {@link ConcurrentHashMap#computeIfAbsent} 한 번으로 이루어지므로, 동시에 같은 채널을 요청한
 * 호출자들은 모두 같은 인스턴스를 받고 {@link ChannelCreatedEvent}는 정확히 한 번 발행됩니다.
 * 호출자는 완전히 생성된 채널만 봅니다.</p>
 *
 * <p><strong>채널 ID 규칙:</strong></p>
 * <ul>
 *   <li>1:1: {@code channel:<정렬된 format()을 | 로 연결>} (예: {@code channel:agent 7|human})</li>
 *   <li>회의: {@code meeting:<회의 ID>} (예: {@code meeting:101})</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class ChannelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private final ConcurrentHashMap<String, Channel> channels = new ConcurrentHashMap<>();
    private final EventBus eventBus;

    public ChannelRegistry(EventBus eventBus) {
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        this.eventBus = eventBus;
    }

    /**
     * 1:1 채널 ID. 인자 순서와 무관합니다.
     *
     * @param a 참가자
     * @param b 참가자
     * @return 채널 ID
     */
    public static String directChannelId(ParticipantId a, ParticipantId b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("participant ids cannot be null");
        }
        String first = a.format();
        String second = b.format();
        return first.compareTo(second) <= 0
            ? "channel:" + first + "|" + second
            : "channel:" + second + "|" + first;
    }

    public static String meetingChannelId(MeetingId meetingId) {
        if (meetingId == null) {
            throw new IllegalArgumentException("meetingId cannot be null");
        }
        return "meeting:" + meetingId.getValue();
    }

    /**
     * 1:1 채널 조회 또는 생성.
     *
     * <p>기존 채널을 돌려줄 때도 두 참가자가 모두 채널에 있도록 맞춥니다.
     * 등록 해제 후 같은 ID로 다시 등록한 참가자는 이 시점에 채널로 돌아옵니다.</p>
     *
     * @throws IllegalArgumentException 참가자가 null이거나 두 참가자가 같은 경우
     */
    public Channel getOrCreateDirect(Participant a, Participant b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("participants cannot be null");
        }
        if (a.id().equals(b.id())) {
            throw new IllegalArgumentException("Cannot open a direct channel with oneself: " + a.id());
        }
        Channel channel = getOrCreate(directChannelId(a.id(), b.id()), null, List.of(a, b));
        boolean rejoined = channel.addParticipant(a);
        rejoined |= channel.addParticipant(b);
        if (rejoined) {
            log.debug("Channel {} rejoined by a re-registered participant", channel.id());
        }
        return channel;
    }

    /**
     * 회의 채널 조회 또는 생성.
     *
     * @param meetingId 회의 ID
     * @param initial 생성 시 참가자 (이미 있으면 무시)
     * @return 회의 채널
     */
    public Channel getOrCreateMeeting(MeetingId meetingId, Collection<? extends Participant> initial) {
        return getOrCreate(meetingChannelId(meetingId), meetingId, List.copyOf(initial));
    }

    public Optional<Channel> find(String channelId) {
        return Optional.ofNullable(channelId == null ? null : channels.get(channelId));
    }

    public Optional<Channel> findMeeting(MeetingId meetingId) {
        return find(meetingChannelId(meetingId));
    }

    /**
     * 모든 채널에서 참가자 제거 (참가자 등록 해제 시).
     *
     * @return 참가자가 제거된 채널 수
     */
    public int removeParticipantEverywhere(ParticipantId participantId) {
        int removed = 0;
        for (Channel channel : channels.values()) {
            if (channel.removeParticipant(participantId)) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return channels.size();
    }

    private Channel getOrCreate(String channelId, MeetingId meetingId, List<? extends Participant> initial) {
        AtomicBoolean created = new AtomicBoolean(false);
        Channel channel = channels.computeIfAbsent(channelId, key -> {
            created.set(true);
            return new Channel(key, meetingId, initial, eventBus);
        });
        if (created.get()) {
            List<ParticipantId> ids = new ArrayList<>();
            channel.participants().forEach(p -> ids.add(p.id()));
            log.info("Channel {} created with {} participant(s)", channelId, ids.size());
            eventBus.publish(new ChannelCreatedEvent(channelId, ids, meetingId, Instant.now()));
        }
        return channel;
    }
}
