package com.ryuqq.parley.adapter.router.meeting;

import com.ryuqq.parley.adapter.router.channel.Channel;
import com.ryuqq.parley.adapter.router.participant.AddressingRules;
import com.ryuqq.parley.adapter.router.participant.HumanParticipant;
import com.ryuqq.parley.application.meeting.MeetingView;
import com.ryuqq.parley.core.event.MeetingStateChangedEvent;
import com.ryuqq.parley.core.exception.MeetingEndedException;
import com.ryuqq.parley.core.exception.MeetingTimeoutException;
import com.ryuqq.parley.core.exception.NotMeetingParticipantException;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.outcome.InviteResult;
import com.ryuqq.parley.core.outcome.LeaveResult;
import com.ryuqq.parley.core.spi.EventBus;
import com.ryuqq.parley.core.spi.Participant;
import com.ryuqq.parley.core.statemachine.InvitationStatus;
import com.ryuqq.parley.core.statemachine.MeetingInvitation;
import com.ryuqq.parley.core.statemachine.MeetingState;
import com.ryuqq.parley.core.statemachine.MeetingTransition;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 하나의 회의 (구조화된 그룹 대화).
 *
 * <p>모든 상태는 하나의 {@link ReentrantLock}으로 보호됩니다. 정족수 대기는 같은 락의
 * {@link Condition}에서 이루어지며, 참여/거절/종료 시 깨어납니다. 알림 메시지 전송은
 * 락 밖에서 {@link MeetingManager}가 수행합니다.</p>
 *
 * <p><strong>멤버십 규칙:</strong></p>
 * <ul>
 *   <li>소유자는 생성 시 바로 참여하며 필수 참석자 목록에 포함되지 않음</li>
 *   <li>필수와 선택에 모두 지정된 참가자는 필수로 취급</li>
 *   <li>필수 참석자 전원이 참여하면 ACTIVE (필수 참석자가 없으면 생성 즉시 ACTIVE)</li>
 *   <li>선택 참석자의 상태는 정족수에 영향을 주지 않음</li>
 *   <li>참여 목록은 명시적인 퇴장/종료 전까지 줄어들지 않음</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class Meeting {

    private final MeetingId id;
    private final ParticipantId owner;
    private final String purpose;
    private final Instant createdAt;
    private final Channel channel;
    private final EventBus eventBus;
    private final int historyLimit;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();

    private MeetingState state = MeetingState.FORMING;
    private final Set<ParticipantId> required = new LinkedHashSet<>();
    private final Set<ParticipantId> optional = new LinkedHashSet<>();
    private final Set<ParticipantId> joined = new LinkedHashSet<>();
    private final Map<ParticipantId, MeetingInvitation> invitations = new LinkedHashMap<>();
    private final LinkedList<Message> history = new LinkedList<>();
    private long droppedFromHistory;
    private final Map<ParticipantId, Long> readCursors = new HashMap<>();
    private final Map<String, String> sharedState = new LinkedHashMap<>();
    private boolean everMultiParty;

    Meeting(
        MeetingId id,
        Participant owner,
        String purpose,
        Channel channel,
        EventBus eventBus,
        int historyLimit
    ) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (purpose == null || purpose.isBlank()) {
            throw new IllegalArgumentException("purpose cannot be null or blank");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        this.id = id;
        this.owner = owner.id();
        this.purpose = purpose;
        this.createdAt = Instant.now();
        this.channel = channel;
        this.eventBus = eventBus;
        this.historyLimit = historyLimit;
        this.joined.add(owner.id());
        this.channel.addParticipant(owner);
    }

    public MeetingId id() {
        return id;
    }

    public ParticipantId owner() {
        return owner;
    }

    public String purpose() {
        return purpose;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Channel channel() {
        return channel;
    }

    public MeetingState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 초대 기록.
     *
     * <p>이미 참여 중이거나 응답 대기 중이면 아무것도 바꾸지 않습니다. 거절했던 참가자는 다시 초대할 수 있습니다.</p>
     *
     * @throws MeetingEndedException 회의가 종료된 경우
     * @throws NotMeetingParticipantException 초대하는 참가자가 참여 중이 아닌 경우
     */
    InviteResult invite(ParticipantId inviter, ParticipantId invitee, boolean asRequired) {
        lock.lock();
        try {
            requireNotEnded("invite");
            if (!joined.contains(inviter)) {
                throw new NotMeetingParticipantException(id, inviter, "invite");
            }
            if (joined.contains(invitee)) {
                return InviteResult.ALREADY_JOINED;
            }
            MeetingInvitation existing = invitations.get(invitee);
            if (existing != null && existing.isPending()) {
                return InviteResult.ALREADY_PENDING;
            }
            if (asRequired) {
                optional.remove(invitee);
                required.add(invitee);
            } else if (!required.contains(invitee)) {
                optional.add(invitee);
            }
            invitations.put(invitee, MeetingInvitation.issue(id, inviter, invitee, required.contains(invitee)));
            return InviteResult.INVITED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 생성 시점의 초대를 한 번에 기록.
     *
     * <p>초대 메시지를 보내기 전에 호출해야 합니다. 먼저 받은 초대 대상이 곧바로 참여해도
     * 나머지 필수 참석자가 이미 정족수에 포함되어 있습니다.</p>
     *
     * @throws MeetingEndedException 회의가 종료된 경우
     * @throws NotMeetingParticipantException 초대하는 참가자가 참여 중이 아닌 경우
     */
    void inviteAll(ParticipantId inviter, Collection<ParticipantId> requiredInvitees,
                   Collection<ParticipantId> optionalInvitees) {
        lock.lock();
        try {
            for (ParticipantId invitee : requiredInvitees) {
                invite(inviter, invitee, true);
            }
            for (ParticipantId invitee : optionalInvitees) {
                invite(inviter, invitee, false);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 초대 수락.
     *
     * @return 참여 결과 (새로 참여했는지, 이번 참여로 ACTIVE가 되었는지)
     * @throws MeetingEndedException 회의가 종료된 경우
     * @throws NotMeetingParticipantException 초대받지 않았거나 거절한 경우
     */
    JoinChange join(Participant participant) {
        ParticipantId pid = participant.id();
        MeetingState before;
        JoinChange change;
        lock.lock();
        try {
            requireNotEnded("join");
            before = state;
            if (joined.contains(pid)) {
                return new JoinChange(false, false, null);
            }
            MeetingInvitation invitation = invitations.get(pid);
            boolean permitted = pid.equals(owner)
                || (invitation != null && invitation.status() != InvitationStatus.REJECTED);
            if (!permitted) {
                throw new NotMeetingParticipantException(id, pid, "join");
            }
            if (invitation != null && invitation.isPending()) {
                invitations.put(pid, invitation.resolve(InvitationStatus.JOINED, null));
            }
            joined.add(pid);
            channel.addParticipant(participant);
            if (joined.size() > 1) {
                everMultiParty = true;
            }
            boolean activated = activateIfQuorumLocked();
            stateChanged.signalAll();
            change = new JoinChange(true, activated, invitation == null ? null : invitation.inviter());
        } finally {
            lock.unlock();
        }
        if (change.activated()) {
            publishTransition(before, MeetingState.ACTIVE);
        }
        return change;
    }

    /**
     * 초대 거절. 정족수 대기는 중단되지 않고 시간 초과까지 계속됩니다.
     *
     * @return 거절이 반영된 초대
     * @throws NotMeetingParticipantException 응답 대기 중인 초대가 없는 경우
     */
    MeetingInvitation reject(ParticipantId participant, String reason) {
        lock.lock();
        try {
            requireNotEnded("reject invitation");
            MeetingInvitation invitation = invitations.get(participant);
            if (invitation == null || !invitation.isPending()) {
                throw new NotMeetingParticipantException(id, participant, "reject a non-pending invitation");
            }
            MeetingInvitation resolved = invitation.resolve(InvitationStatus.REJECTED, reason);
            invitations.put(participant, resolved);
            stateChanged.signalAll();
            return resolved;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 필수 참석자가 없거나 이미 전원 참여했으면 ACTIVE로 전이.
     *
     * @return 이번 호출로 전이했으면 true
     */
    boolean activateIfQuorum() {
        boolean activated;
        lock.lock();
        try {
            activated = activateIfQuorumLocked();
            if (activated) {
                stateChanged.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (activated) {
            publishTransition(MeetingState.FORMING, MeetingState.ACTIVE);
        }
        return activated;
    }

    /**
     * 정족수 대기.
     *
     * @throws MeetingTimeoutException 시간 내 필수 참석자 전원이 참여하지 않은 경우
     * @throws MeetingEndedException 대기 중 회의가 종료된 경우
     */
    MeetingView awaitQuorum(Duration timeout) {
        lock.lock();
        try {
            long remaining = timeout.toNanos();
            while (state == MeetingState.FORMING && remaining > 0L) {
                remaining = stateChanged.awaitNanos(remaining);
            }
            if (state == MeetingState.ENDED) {
                throw new MeetingEndedException(id, "reach quorum");
            }
            if (state == MeetingState.FORMING) {
                throw new MeetingTimeoutException(id, missingRequiredLocked(), timeout.toMillis());
            }
            return viewLocked();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for quorum of meeting " + id.getValue(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 퇴장.
     *
     * <p>여러 명이 참여했던 회의에서 마지막 한 명이 확인 없이 나가려 하면 상태를 바꾸지 않고
     * {@link LeaveResult#CONFIRMATION_REQUIRED}를 돌려줍니다.</p>
     *
     * @throws MeetingEndedException 회의가 종료된 경우
     * @throws NotMeetingParticipantException 참여한 적이 없는 참가자인 경우
     */
    LeaveResult leave(ParticipantId participant, boolean confirmed) {
        MeetingState before;
        LeaveResult result;
        lock.lock();
        try {
            requireNotEnded("leave");
            before = state;
            if (!joined.contains(participant)) {
                if (wasMemberLocked(participant)) {
                    return LeaveResult.ALREADY_LEFT;
                }
                throw new NotMeetingParticipantException(id, participant, "leave");
            }
            if (joined.size() == 1 && everMultiParty && !confirmed) {
                return LeaveResult.CONFIRMATION_REQUIRED;
            }
            joined.remove(participant);
            channel.removeParticipant(participant);
            if (joined.isEmpty()) {
                state = MeetingTransition.transition(state, MeetingState.ENDED);
                result = LeaveResult.MEETING_ENDED;
            } else {
                result = LeaveResult.LEFT;
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        if (result == LeaveResult.MEETING_ENDED) {
            publishTransition(before, MeetingState.ENDED);
        }
        return result;
    }

    /**
     * 종료.
     *
     * @return 이번 호출로 종료되었으면 true, 이미 종료된 경우 false
     * @throws NotMeetingParticipantException 소유자도 참여자도 아닌 경우
     */
    boolean end(ParticipantId requester) {
        MeetingState before;
        lock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            if (!requester.equals(owner) && !joined.contains(requester)) {
                throw new NotMeetingParticipantException(id, requester, "end");
            }
            before = state;
            state = MeetingTransition.transition(state, MeetingState.ENDED);
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        publishTransition(before, MeetingState.ENDED);
        return true;
    }

    /**
     * 참여자의 발언을 히스토리에 추가.
     *
     * @throws MeetingEndedException 회의가 종료된 경우
     * @throws NotMeetingParticipantException 발신자가 참여 중이 아닌 경우
     */
    void appendFromMember(Message message) {
        lock.lock();
        try {
            requireNotEnded("broadcast");
            if (!joined.contains(message.sender())) {
                throw new NotMeetingParticipantException(id, message.sender(), "broadcast");
            }
            appendLocked(message);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 발언 가능 여부 확인 (스트림 시작 전).
     *
     * @throws MeetingEndedException 회의가 종료된 경우
     * @throws NotMeetingParticipantException 참여 중이 아닌 경우
     */
    void requireSpeaker(ParticipantId participant) {
        lock.lock();
        try {
            requireNotEnded("broadcast");
            if (!joined.contains(participant)) {
                throw new NotMeetingParticipantException(id, participant, "broadcast");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 알림 메시지를 히스토리에 기록 (멤버십 검사 없음).
     */
    void recordNotice(Message notice) {
        lock.lock();
        try {
            appendLocked(notice);
        } finally {
            lock.unlock();
        }
    }

    public List<Message> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 참가자가 아직 읽지 않은 메시지 (자신이 보낸 메시지 제외, 읽음 위치는 그대로).
     */
    public List<Message> unreadFor(ParticipantId participant) {
        lock.lock();
        try {
            long cursor = Math.max(readCursors.getOrDefault(participant, 0L), droppedFromHistory);
            List<Message> unread = new ArrayList<>();
            long index = droppedFromHistory;
            for (Message message : history) {
                if (index >= cursor && !message.sender().equals(participant)) {
                    unread.add(message);
                }
                index++;
            }
            return unread;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 읽음 위치를 히스토리 끝으로 이동.
     */
    public void markRead(ParticipantId participant) {
        lock.lock();
        try {
            readCursors.put(participant, droppedFromHistory + history.size());
        } finally {
            lock.unlock();
        }
    }

    public Map<String, String> sharedState() {
        lock.lock();
        try {
            return Map.copyOf(sharedState);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 공유 상태 갱신.
     *
     * @throws MeetingEndedException 회의가 종료된 경우
     * @throws NotMeetingParticipantException 참여 중이 아닌 경우
     */
    public void putSharedState(ParticipantId participant, String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        lock.lock();
        try {
            requireNotEnded("update shared state");
            if (!joined.contains(participant)) {
                throw new NotMeetingParticipantException(id, participant, "update shared state");
            }
            sharedState.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 이 회의의 발언을 참가자에게 점진 표시할지 결정.
     *
     * <p>사람 참가자는 전달 선호를 따르고, 그 밖의 참가자는 점진 표시 지원 여부만 봅니다.
     * 스트림 시작 시점의 원형은 본문이 비어 있어 명시 대상만 지목으로 판단됩니다.</p>
     */
    public boolean shouldStreamTo(Participant participant, Message message) {
        if (participant instanceof HumanParticipant) {
            return ((HumanParticipant) participant).wantsMeetingStream(message);
        }
        return participant.supportsIncrementalDisplay();
    }

    /**
     * 메시지가 참가자를 지목하는지 확인.
     */
    public boolean isAddressedTo(Message message, Participant participant) {
        return AddressingRules.isAddressedTo(message, participant);
    }

    public boolean isJoined(ParticipantId participant) {
        lock.lock();
        try {
            return joined.contains(participant);
        } finally {
            lock.unlock();
        }
    }

    public Optional<MeetingInvitation> invitation(ParticipantId invitee) {
        lock.lock();
        try {
            return Optional.ofNullable(invitations.get(invitee));
        } finally {
            lock.unlock();
        }
    }

    public List<ParticipantId> joined() {
        lock.lock();
        try {
            return List.copyOf(joined);
        } finally {
            lock.unlock();
        }
    }

    public MeetingView view() {
        lock.lock();
        try {
            return viewLocked();
        } finally {
            lock.unlock();
        }
    }

    private MeetingView viewLocked() {
        return new MeetingView(
            id,
            owner,
            purpose,
            state,
            List.copyOf(required),
            List.copyOf(optional),
            List.copyOf(joined),
            Map.copyOf(invitations),
            (int) (droppedFromHistory + history.size()),
            Map.copyOf(sharedState)
        );
    }

    private boolean activateIfQuorumLocked() {
        if (state == MeetingState.FORMING && joined.containsAll(required)) {
            state = MeetingTransition.transition(state, MeetingState.ACTIVE);
            return true;
        }
        return false;
    }

    private List<ParticipantId> missingRequiredLocked() {
        List<ParticipantId> missing = new ArrayList<>();
        for (ParticipantId participant : required) {
            if (!joined.contains(participant)) {
                missing.add(participant);
            }
        }
        return missing;
    }

    private boolean wasMemberLocked(ParticipantId participant) {
        if (participant.equals(owner)) {
            return true;
        }
        MeetingInvitation invitation = invitations.get(participant);
        return invitation != null && invitation.status() == InvitationStatus.JOINED;
    }

    private void appendLocked(Message message) {
        history.addLast(message);
        while (history.size() > historyLimit) {
            history.removeFirst();
            droppedFromHistory++;
        }
    }

    private void requireNotEnded(String operation) {
        if (state.isTerminal()) {
            throw new MeetingEndedException(id, operation);
        }
    }

    private void publishTransition(MeetingState from, MeetingState to) {
        if (eventBus != null) {
            eventBus.publish(new MeetingStateChangedEvent(id, from, to, Instant.now()));
        }
    }

    /**
     * 참여 결과.
     *
     * @param newlyJoined 이번 호출로 참여했는지
     * @param activated 이번 참여로 ACTIVE가 되었는지
     * @param inviter 초대한 참가자 (소유자 본인의 재참여이면 null)
     */
    record JoinChange(boolean newlyJoined, boolean activated, ParticipantId inviter) {
    }
}
