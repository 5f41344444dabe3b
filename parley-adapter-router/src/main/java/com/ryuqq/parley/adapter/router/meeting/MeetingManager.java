package com.ryuqq.parley.adapter.router.meeting;

import com.ryuqq.parley.adapter.router.ParleyConfig;
import com.ryuqq.parley.adapter.router.channel.Channel;
import com.ryuqq.parley.adapter.router.channel.ChannelRegistry;
import com.ryuqq.parley.adapter.router.participant.ParticipantDirectory;
import com.ryuqq.parley.adapter.router.stream.StreamCoordinator;
import com.ryuqq.parley.application.meeting.MeetingCoordinator;
import com.ryuqq.parley.application.meeting.MeetingView;
import com.ryuqq.parley.core.exception.DeliveryFailureException;
import com.ryuqq.parley.core.exception.MeetingTimeoutException;
import com.ryuqq.parley.core.exception.UnknownRecipientException;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.outcome.DeliveryReport;
import com.ryuqq.parley.core.outcome.InviteResult;
import com.ryuqq.parley.core.outcome.LeaveResult;
import com.ryuqq.parley.core.outcome.StreamStartResult;
import com.ryuqq.parley.core.spi.EventBus;
import com.ryuqq.parley.core.spi.Participant;
import com.ryuqq.parley.core.statemachine.MeetingInvitation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MeetingCoordinator} 구현.
 *
 * <p>회의 상태 변경은 {@link Meeting}의 락 안에서, 알림 메시지 전송은 락 밖에서 수행합니다.</p>
 *
 * <p><strong>알림 규칙:</strong></p>
 * <ul>
 *   <li>초대: 초대 대상의 1:1 채널로 MEETING_INVITATION 전송, 기존 참여자에게 "초대함" 알림</li>
 *   <li>응답: 초대한 참가자에게 1:1 MEETING_INVITATION_RESPONSE, 나머지 참여자에게 결과 알림</li>
 *   <li>정족수 도달: 그룹 채널로 "회의 시작" 알림</li>
 *   <li>퇴장/종료: 남은 참여자에게 이름을 밝힌 알림</li>
 * </ul>
 *
 * <p>회의 ID는 {@link ParleyConfig#firstMeetingNumber()}부터 1씩 증가합니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class MeetingManager implements MeetingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MeetingManager.class);

    private final ParticipantDirectory directory;
    private final ChannelRegistry channels;
    private final StreamCoordinator streams;
    private final EventBus eventBus;
    private final ParleyConfig config;
    private final Map<MeetingId, Meeting> meetings = new ConcurrentHashMap<>();
    private final AtomicLong nextNumber;

    public MeetingManager(
        ParticipantDirectory directory,
        ChannelRegistry channels,
        StreamCoordinator streams,
        EventBus eventBus,
        ParleyConfig config
    ) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (channels == null) {
            throw new IllegalArgumentException("channels cannot be null");
        }
        if (streams == null) {
            throw new IllegalArgumentException("streams cannot be null");
        }
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.directory = directory;
        this.channels = channels;
        this.streams = streams;
        this.eventBus = eventBus;
        this.config = config;
        this.nextNumber = new AtomicLong(config.firstMeetingNumber());
    }

    @Override
    public MeetingId openMeeting(
        ParticipantId owner,
        String purpose,
        List<ParticipantId> required,
        List<ParticipantId> optional
    ) {
        if (purpose == null || purpose.isBlank()) {
            throw new IllegalArgumentException("purpose cannot be null or blank");
        }
        Participant ownerParticipant = directory.require(owner);
        Set<ParticipantId> requiredSet = new LinkedHashSet<>(required == null ? List.of() : required);
        requiredSet.remove(owner);
        Set<ParticipantId> optionalSet = new LinkedHashSet<>(optional == null ? List.of() : optional);
        optionalSet.remove(owner);
        optionalSet.removeAll(requiredSet);
        for (ParticipantId invitee : requiredSet) {
            directory.require(invitee);
        }
        for (ParticipantId invitee : optionalSet) {
            directory.require(invitee);
        }

        MeetingId meetingId = MeetingId.of(String.valueOf(nextNumber.getAndIncrement()));
        Channel channel = channels.getOrCreateMeeting(meetingId, List.of(ownerParticipant));
        Meeting meeting = new Meeting(meetingId, ownerParticipant, purpose, channel, eventBus, config.historyLimit());
        if (meetings.putIfAbsent(meetingId, meeting) != null) {
            throw new IllegalStateException("Meeting id already in use: " + meetingId);
        }
        log.info("Meeting {} '{}' created by {}, required={}, optional={}",
            meetingId.getValue(), purpose, owner, requiredSet, optionalSet);

        meeting.inviteAll(owner, requiredSet, optionalSet);
        for (ParticipantId invitee : requiredSet) {
            sendInvitation(meeting, ownerParticipant, invitee, true);
        }
        for (ParticipantId invitee : optionalSet) {
            sendInvitation(meeting, ownerParticipant, invitee, false);
        }
        if (meeting.activateIfQuorum()) {
            announceStart(meeting);
        }
        return meetingId;
    }

    @Override
    public MeetingView awaitQuorum(MeetingId meetingId, Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        Meeting meeting = require(meetingId);
        try {
            return meeting.awaitQuorum(timeout);
        } catch (MeetingTimeoutException e) {
            log.warn("Meeting {} did not reach quorum within {}ms, missing {}",
                meetingId.getValue(), timeout.toMillis(), e.missingAttendees());
            throw e;
        }
    }

    @Override
    public MeetingId createMeeting(
        ParticipantId owner,
        String purpose,
        List<ParticipantId> required,
        List<ParticipantId> optional,
        Duration timeout
    ) {
        MeetingId meetingId = openMeeting(owner, purpose, required, optional);
        awaitQuorum(meetingId, timeout);
        return meetingId;
    }

    @Override
    public MeetingId createMeeting(
        ParticipantId owner,
        String purpose,
        List<ParticipantId> required,
        List<ParticipantId> optional
    ) {
        return createMeeting(owner, purpose, required, optional, config.quorumTimeout());
    }

    @Override
    public boolean joinMeeting(MeetingId meetingId, ParticipantId participant) {
        Meeting meeting = require(meetingId);
        Participant joiner = directory.require(participant);
        Meeting.JoinChange change = meeting.join(joiner);
        if (!change.newlyJoined()) {
            log.debug("{} already joined meeting {}", participant, meetingId.getValue());
            return false;
        }
        log.info("{} joined meeting {}", participant, meetingId.getValue());

        Set<ParticipantId> excluded = new LinkedHashSet<>();
        excluded.add(participant);
        if (change.inviter() != null) {
            sendInvitationResponse(meeting, joiner, change.inviter(), joiner.displayName() + " accepted the invitation");
            excluded.add(change.inviter());
        }
        notice(meeting, participant, joiner.displayName() + " joined the meeting", excluded);
        if (change.activated()) {
            announceStart(meeting);
        }
        return true;
    }

    @Override
    public void rejectInvitation(MeetingId meetingId, ParticipantId participant, String reason) {
        Meeting meeting = require(meetingId);
        Participant rejecter = directory.require(participant);
        MeetingInvitation invitation = meeting.reject(participant, reason);
        String text = rejecter.displayName() + " declined the invitation"
            + (reason == null || reason.isBlank() ? "" : ": " + reason);
        log.info("{} rejected meeting {} invitation, reason={}", participant, meetingId.getValue(), reason);

        sendInvitationResponse(meeting, rejecter, invitation.inviter(), text);
        Set<ParticipantId> excluded = new LinkedHashSet<>();
        excluded.add(participant);
        excluded.add(invitation.inviter());
        notice(meeting, participant, text, excluded);
    }

    @Override
    public InviteResult invite(MeetingId meetingId, ParticipantId inviter, ParticipantId invitee, boolean required) {
        Meeting meeting = require(meetingId);
        Participant inviterParticipant = directory.require(inviter);
        Participant inviteeParticipant = directory.require(invitee);
        InviteResult result = meeting.invite(inviter, invitee, required);
        if (!result.isNewInvitation()) {
            log.debug("Invite of {} to meeting {} ignored: {}", invitee, meetingId.getValue(), result);
            return result;
        }
        sendInvitation(meeting, inviterParticipant, invitee, required);
        notice(meeting, inviter,
            inviterParticipant.displayName() + " invited " + inviteeParticipant.displayName(), Set.of(inviter));
        return result;
    }

    @Override
    public DeliveryReport broadcast(
        MeetingId meetingId,
        ParticipantId sender,
        String content,
        List<ParticipantId> targets
    ) {
        Meeting meeting = require(meetingId);
        Message message = Message.meetingBroadcast(sender, meetingId, content, targets);
        return deliverBroadcast(meeting, message);
    }

    /**
     * 회의 스트림 시작. 사람 참가자의 전달 선호를 반영합니다.
     *
     * @param targets 명시 대상
     * @return 시작 또는 건너뜀 결과
     */
    public StreamStartResult startStream(MeetingId meetingId, ParticipantId sender, List<ParticipantId> targets) {
        Meeting meeting = require(meetingId);
        meeting.requireSpeaker(sender);
        Message template = Message.meetingBroadcast(sender, meetingId, "", targets);
        return streams.startStream(
            meeting.channel(),
            template,
            participant -> meeting.shouldStreamTo(participant, template),
            finalMessage -> deliverBroadcast(meeting, finalMessage)
        );
    }

    @Override
    public LeaveResult leaveMeeting(MeetingId meetingId, ParticipantId participant) {
        return leaveMeeting(meetingId, participant, false);
    }

    @Override
    public LeaveResult leaveMeeting(MeetingId meetingId, ParticipantId participant, boolean confirmed) {
        Meeting meeting = require(meetingId);
        LeaveResult result = meeting.leave(participant, confirmed);
        String name = directory.find(participant).map(Participant::displayName).orElse(participant.getValue());
        switch (result) {
            case LEFT -> {
                log.info("{} left meeting {}", participant, meetingId.getValue());
                notice(meeting, participant, name + " left the meeting", Set.of(participant));
            }
            case CONFIRMATION_REQUIRED -> {
                log.info("{} is the last participant of meeting {}, asking for confirmation",
                    participant, meetingId.getValue());
                promptLastParticipant(meeting, participant);
            }
            case MEETING_ENDED -> log.info("Meeting {} ended after {} left", meetingId.getValue(), participant);
            case ALREADY_LEFT -> log.debug("{} already left meeting {}", participant, meetingId.getValue());
        }
        return result;
    }

    @Override
    public boolean endMeeting(MeetingId meetingId, ParticipantId requester) {
        Meeting meeting = require(meetingId);
        if (!meeting.end(requester)) {
            log.debug("Meeting {} already ended", meetingId.getValue());
            return false;
        }
        String name = directory.find(requester).map(Participant::displayName).orElse(requester.getValue());
        log.info("Meeting {} ended by {}", meetingId.getValue(), requester);
        notice(meeting, requester, "Meeting " + meetingId.getValue() + " was ended by " + name, Set.of(requester));
        return true;
    }

    @Override
    public Optional<MeetingView> findMeeting(MeetingId meetingId) {
        return Optional.ofNullable(meetingId == null ? null : meetings.get(meetingId)).map(Meeting::view);
    }

    /**
     * 회의 조회.
     *
     * @throws UnknownRecipientException 존재하지 않는 회의인 경우
     */
    public Meeting require(MeetingId meetingId) {
        if (meetingId == null) {
            throw new IllegalArgumentException("meetingId cannot be null");
        }
        Meeting meeting = meetings.get(meetingId);
        if (meeting == null) {
            throw new UnknownRecipientException(meetingId);
        }
        return meeting;
    }

    @Override
    public List<Message> history(MeetingId meetingId) {
        return require(meetingId).history();
    }

    @Override
    public List<Message> unreadFor(MeetingId meetingId, ParticipantId participant) {
        return require(meetingId).unreadFor(participant);
    }

    @Override
    public void markRead(MeetingId meetingId, ParticipantId participant) {
        require(meetingId).markRead(participant);
    }

    @Override
    public Map<String, String> sharedState(MeetingId meetingId) {
        return require(meetingId).sharedState();
    }

    @Override
    public void putSharedState(MeetingId meetingId, ParticipantId participant, String key, String value) {
        require(meetingId).putSharedState(participant, key, value);
    }

    @Override
    public boolean isEngaged(ParticipantId participant) {
        for (Meeting meeting : meetings.values()) {
            if (!meeting.state().isTerminal() && meeting.isJoined(participant)) {
                return true;
            }
        }
        return false;
    }

    private DeliveryReport deliverBroadcast(Meeting meeting, Message message) {
        meeting.appendFromMember(message);
        return meeting.channel().send(message, message.sender());
    }

    private void sendInvitation(Meeting meeting, Participant inviter, ParticipantId invitee, boolean required) {
        Participant target = directory.require(invitee);
        String content = inviter.displayName() + " invites you to meeting " + meeting.id().getValue()
            + " (" + (required ? "required" : "optional") + "): " + meeting.purpose();
        Message invitation = Message.invitation(inviter.id(), invitee, meeting.id(), content);
        DeliveryReport report = channels.getOrCreateDirect(inviter, target).send(invitation, inviter.id());
        if (report.hasFailures()) {
            log.warn("Invitation to {} for meeting {} was not delivered: {}",
                invitee, meeting.id().getValue(), report.failures());
        }
    }

    private void sendInvitationResponse(Meeting meeting, Participant invitee, ParticipantId inviter, String content) {
        Optional<Participant> target = directory.find(inviter);
        if (target.isEmpty()) {
            log.warn("Inviter {} of meeting {} is no longer registered, response dropped",
                inviter, meeting.id().getValue());
            return;
        }
        Message response = Message.invitationResponse(invitee.id(), inviter, meeting.id(), content);
        channels.getOrCreateDirect(invitee, target.get()).send(response, invitee.id());
    }

    private void announceStart(Meeting meeting) {
        log.info("Meeting {} is ACTIVE, all required attendees joined", meeting.id().getValue());
        notice(meeting, meeting.owner(),
            "Meeting " + meeting.id().getValue() + " started: " + meeting.purpose(), Set.of(meeting.owner()));
    }

    private void notice(Meeting meeting, ParticipantId actor, String content, Set<ParticipantId> excluded) {
        Message notice = Message.meetingBroadcast(actor, meeting.id(), content, List.of());
        meeting.recordNotice(notice);
        DeliveryReport report = meeting.channel().send(notice, excluded);
        if (report.hasFailures()) {
            log.warn("Meeting {} notice reached {} of {} participant(s)",
                meeting.id().getValue(), report.delivered().size(), report.recipientCount());
        }
    }

    private void promptLastParticipant(Meeting meeting, ParticipantId participant) {
        Participant last = directory.require(participant);
        String content = "You are the last participant in meeting " + meeting.id().getValue()
            + ". Leave again with confirmation, or end the meeting.";
        Message prompt = Message.meetingBroadcast(participant, meeting.id(), content, List.of(participant));
        try {
            last.deliver(prompt);
        } catch (RuntimeException e) {
            throw new DeliveryFailureException(participant, e);
        }
    }

    /**
     * 관리 중인 회의 ID (생성 순서 보장 없음).
     */
    public List<MeetingId> meetingIds() {
        return new ArrayList<>(meetings.keySet());
    }
}
