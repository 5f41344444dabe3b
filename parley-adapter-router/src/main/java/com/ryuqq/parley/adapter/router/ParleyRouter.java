package com.ryuqq.parley.adapter.router;

import com.ryuqq.parley.adapter.router.channel.Channel;
import com.ryuqq.parley.adapter.router.channel.ChannelRegistry;
import com.ryuqq.parley.adapter.router.meeting.MeetingManager;
import com.ryuqq.parley.adapter.router.participant.LocalParticipant;
import com.ryuqq.parley.adapter.router.participant.ParticipantDirectory;
import com.ryuqq.parley.adapter.router.stream.StreamCoordinator;
import com.ryuqq.parley.adapter.router.stream.StreamObserver;
import com.ryuqq.parley.application.meeting.MeetingCoordinator;
import com.ryuqq.parley.application.router.MessageRouter;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.message.MessageType;
import com.ryuqq.parley.core.model.IdentifierParser;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.model.RecipientSpec;
import com.ryuqq.parley.core.model.SourceSpec;
import com.ryuqq.parley.core.outcome.DeliveryReport;
import com.ryuqq.parley.core.outcome.StreamStartResult;
import com.ryuqq.parley.core.spi.EventBus;
import com.ryuqq.parley.core.spi.Participant;
import com.ryuqq.parley.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * {@link MessageRouter} 구현.
 *
 * <p>참가자 레지스트리, 채널 레지스트리, 스트림 조정자, 회의 관리자를 하나로 묶습니다.
 * 새 채널과 회의는 이 라우터가 가진 레지스트리를 통해서만 원자적으로 생성됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EventBus bus = new InMemoryEventBus();
 * ParleyRouter router = new ParleyRouter(bus, new ParleyConfig());
 *
 * router.register(new HumanParticipant(HumanRef.defaultHuman(), new InMemoryInbox("human")));
 * router.register(new AgentParticipant(AgentId.of("7"), "Planner", new InMemoryInbox("agent 7")));
 *
 * router.routeMessage(HumanRef.defaultHuman(), "agent 7", "hello", MessageType.DIRECT);
 * List&lt;Message&gt; batch = router.waitForMessages(AgentId.of("7"), "*", Duration.ofSeconds(1));
 * </pre>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class ParleyRouter implements MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(ParleyRouter.class);

    private final ParleyConfig config;
    private final ParticipantDirectory directory;
    private final ChannelRegistry channels;
    private final StreamCoordinator streams;
    private final MeetingManager meetings;
    private final WaitPolicy waitPolicy;

    public ParleyRouter(EventBus eventBus, ParleyConfig config) {
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.directory = new ParticipantDirectory();
        this.channels = new ChannelRegistry(eventBus);
        this.streams = new StreamCoordinator(eventBus);
        this.meetings = new MeetingManager(directory, channels, streams, eventBus, config);
        this.waitPolicy = new WaitPolicy(config);
    }

    @Override
    public void register(Participant participant) {
        directory.register(participant);
    }

    /**
     * {@inheritDoc}
     *
     * <p>참가자를 모든 채널에서 제거하고, 프로세스 내 참가자이면 받은편지함을 닫아 대기 중인 호출을 깨웁니다.</p>
     */
    @Override
    public void unregister(ParticipantId participantId) {
        directory.unregister(participantId).ifPresent(participant -> {
            channels.removeParticipantEverywhere(participantId);
            if (participant instanceof LocalParticipant) {
                ((LocalParticipant) participant).inbox().close();
            }
        });
    }

    @Override
    public boolean isRegistered(ParticipantId participantId) {
        return directory.contains(participantId);
    }

    @Override
    public DeliveryReport routeMessage(ParticipantId sender, String recipientSpec, String content, MessageType type) {
        return routeMessage(sender, IdentifierParser.parseRecipient(recipientSpec), content, type);
    }

    @Override
    public DeliveryReport routeMessage(ParticipantId sender, RecipientSpec recipient, String content, MessageType type) {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        Participant from = directory.require(sender);

        if (recipient.isMeeting()) {
            requireType(type, MessageType.MEETING_BROADCAST, recipient);
            log.debug("Routing meeting message from {} to meeting {} targets={}",
                sender, recipient.meetingId().getValue(), recipient.targets());
            return meetings.broadcast(recipient.meetingId(), sender, content, recipient.targets());
        }

        requireType(type, MessageType.DIRECT, recipient);
        Participant to = directory.require(recipient.participantId());
        Channel channel = channels.getOrCreateDirect(from, to);
        log.debug("Routing direct message from {} to {} via {}", sender, to.id(), channel.id());
        return channel.send(Message.direct(sender, to.id(), content), sender);
    }

    @Override
    public List<Message> waitForMessages(ParticipantId participant, String sourceSpec, Duration timeout) {
        return waitForMessages(participant, IdentifierParser.parseSource(sourceSpec), timeout);
    }

    @Override
    public List<Message> waitForMessages(ParticipantId participant, SourceSpec source) {
        return waitForMessages(participant, source, null);
    }

    @Override
    public List<Message> waitForMessages(ParticipantId participant, SourceSpec source, Duration timeout) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative");
        }
        LocalParticipant waiter = directory.requireLocal(participant);
        WaitPolicy.Window window = waitPolicy.windowFor(waiter, source, timeout);
        log.debug("{} waiting on {} for up to {}ms ({})", participant, source, window.waitTime().toMillis(),
            window.targeted() ? "targeted" : "passive");
        return waiter.inbox().getBatch(
            window.filter(), window.waitTime(), window.minItems(), window.maxItems(), Message::isFromHuman);
    }

    @Override
    public StreamStartResult startStream(ParticipantId sender, String recipientSpec) {
        RecipientSpec recipient = IdentifierParser.parseRecipient(recipientSpec);
        Participant from = directory.require(sender);
        if (recipient.isMeeting()) {
            return meetings.startStream(recipient.meetingId(), sender, recipient.targets());
        }
        Participant to = directory.require(recipient.participantId());
        Channel channel = channels.getOrCreateDirect(from, to);
        Message template = Message.direct(sender, to.id(), "");
        return streams.startStream(channel, template, participant -> true,
            finalMessage -> channel.send(finalMessage, sender));
    }

    @Override
    public void streamChunk(String streamId, String chunk) {
        streams.streamChunk(streamId, chunk);
    }

    @Override
    public DeliveryReport completeStream(String streamId) {
        return streams.completeStream(streamId);
    }

    /**
     * 스트림 이벤트 관찰.
     *
     * @param viewer 관찰할 수신자 (null이면 모든 수신자)
     * @param observer 관찰자
     * @return 구독 핸들
     */
    public Subscription observeStreams(ParticipantId viewer, StreamObserver observer) {
        return streams.observe(viewer, observer);
    }

    @Override
    public MeetingCoordinator meetings() {
        return meetings;
    }

    public ChannelRegistry channels() {
        return channels;
    }

    public ParleyConfig config() {
        return config;
    }

    private static void requireType(MessageType type, MessageType expected, RecipientSpec recipient) {
        if (type != null && type != expected) {
            throw new IllegalArgumentException(
                "Message type " + type + " cannot be routed to " + recipient.destination() + ", expected " + expected);
        }
    }
}
