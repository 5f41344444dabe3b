package com.ryuqq.parley.testkit.contract;

import com.ryuqq.parley.adapter.router.participant.AgentParticipant;
import com.ryuqq.parley.adapter.router.participant.HumanParticipant;
import com.ryuqq.parley.application.meeting.MeetingView;
import com.ryuqq.parley.core.event.MeetingStateChangedEvent;
import com.ryuqq.parley.core.exception.MeetingEndedException;
import com.ryuqq.parley.core.exception.MeetingTimeoutException;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.message.MessageType;
import com.ryuqq.parley.core.model.AgentId;
import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.statemachine.InvitationStatus;
import com.ryuqq.parley.core.statemachine.MeetingState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for meeting quorum.
 *
 * <p>A meeting stays FORMING until every required attendee joined. Optional attendees never
 * hold it back, and rejections do not cut the wait short.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>One required attendee rejects → timeout naming exactly that attendee</li>
 *   <li>All required attendees join → ACTIVE, optional attendee still pending</li>
 *   <li>No required attendees → ACTIVE at creation</li>
 *   <li>Meeting ended while waiting → MeetingEndedException</li>
 *   <li>Invitee joins during delivery of its invitation → still FORMING until the rest join</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
class QuorumContractTest extends AbstractParleyContractTest {

    @Test
    void testCreateMeeting_RequiredAttendeeRejects_TimeoutNamesMissingAttendee() throws Exception {
        // Given
        HumanParticipant human = registerHuman();
        AgentParticipant alpha = registerAgent("1", "Alpha");
        AgentParticipant beta = registerAgent("2", "Beta");

        Future<?> alphaJoins = executor.submit(() -> {
            MeetingId meetingId = awaitInvitation(alpha);
            sleep(100);
            meetings.joinMeeting(meetingId, alpha.id());
        });
        Future<?> betaRejects = executor.submit(() -> {
            MeetingId meetingId = awaitInvitation(beta);
            sleep(200);
            meetings.rejectInvitation(meetingId, beta.id(), "busy");
        });

        // When
        MeetingTimeoutException timeout = assertThrows(MeetingTimeoutException.class,
            () -> meetings.createMeeting(human.id(), "Planning",
                List.of(alpha.id(), beta.id()), List.of(), Duration.ofMillis(800)));
        alphaJoins.get(5, TimeUnit.SECONDS);
        betaRejects.get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(List.of(beta.id()), timeout.missingAttendees(), "Only the rejecting attendee is missing");
        assertEquals(MeetingTimeoutException.ERROR_CODE, timeout.errorCode());

        MeetingView view = meetings.findMeeting(timeout.meetingId()).orElseThrow();
        assertEquals(MeetingState.FORMING, view.state());
        assertTrue(view.isJoined(alpha.id()));
        assertEquals(InvitationStatus.REJECTED, view.invitations().get(beta.id()).status());
        assertEquals("busy", view.invitations().get(beta.id()).reason());
    }

    @Test
    void testCreateMeeting_RequiredAttendeesJoinInBackground_ReturnsActiveMeeting() throws Exception {
        // Given
        HumanParticipant human = registerHuman();
        AgentParticipant alpha = registerAgent("1", "Alpha");
        AgentParticipant beta = registerAgent("2", "Beta");
        RecordingListener<MeetingStateChangedEvent> transitions = new RecordingListener<>();
        eventBus.subscribe(MeetingStateChangedEvent.class, transitions);

        Future<?> alphaJoins = executor.submit(() -> meetings.joinMeeting(awaitInvitation(alpha), alpha.id()));
        Future<?> betaJoins = executor.submit(() -> meetings.joinMeeting(awaitInvitation(beta), beta.id()));

        // When
        MeetingId meetingId = meetings.createMeeting(human.id(), "Planning",
            List.of(alpha.id(), beta.id()), List.of(), Duration.ofSeconds(5));
        alphaJoins.get(5, TimeUnit.SECONDS);
        betaJoins.get(5, TimeUnit.SECONDS);

        // Then
        assertMeetingState(meetingId, MeetingState.ACTIVE);
        assertEquals(1, transitions.count(), "FORMING → ACTIVE must be published once");
        assertEquals(MeetingState.ACTIVE, transitions.events().get(0).to());
    }

    @Test
    void testOpenMeeting_OptionalAttendeeSilent_QuorumIgnoresOptional() {
        // Given
        HumanParticipant human = registerHuman();
        AgentParticipant alpha = registerAgent("1", "Alpha");
        AgentParticipant beta = registerAgent("2", "Beta");
        AgentParticipant gamma = registerAgent("3", "Gamma");
        MeetingId meetingId = meetings.openMeeting(human.id(), "Review",
            List.of(alpha.id(), beta.id()), List.of(gamma.id()));

        // When
        meetings.joinMeeting(meetingId, alpha.id());
        assertMeetingState(meetingId, MeetingState.FORMING);
        meetings.joinMeeting(meetingId, beta.id());

        // Then
        MeetingView view = meetings.awaitQuorum(meetingId, Duration.ofMillis(100));
        assertEquals(MeetingState.ACTIVE, view.state());
        assertTrue(view.missingRequired().isEmpty());
        assertEquals(InvitationStatus.PENDING, view.invitations().get(gamma.id()).status(),
            "Optional attendee can still answer after activation");

        // Optional attendee may join an active meeting
        assertTrue(meetings.joinMeeting(meetingId, gamma.id()));
        assertTrue(meetings.findMeeting(meetingId).orElseThrow().isJoined(gamma.id()));
    }

    @Test
    void testOpenMeeting_NoRequiredAttendees_ActiveImmediately() {
        // Given
        HumanParticipant human = registerHuman();
        AgentParticipant alpha = registerAgent("1", "Alpha");

        // When
        MeetingId meetingId = meetings.openMeeting(human.id(), "Drop-in", List.of(), List.of(alpha.id()));

        // Then
        assertMeetingState(meetingId, MeetingState.ACTIVE);
        assertEquals(MeetingState.ACTIVE, meetings.awaitQuorum(meetingId, Duration.ZERO).state());
    }

    @Test
    void testAwaitQuorum_MeetingEndedWhileWaiting_ThrowsMeetingEnded() throws Exception {
        // Given
        HumanParticipant human = registerHuman();
        AgentParticipant alpha = registerAgent("1", "Alpha");
        MeetingId meetingId = meetings.openMeeting(human.id(), "Cancelled", List.of(alpha.id()), List.of());

        Future<?> ender = executor.submit(() -> {
            sleep(100);
            meetings.endMeeting(meetingId, human.id());
        });

        // When
        long startedAt = System.nanoTime();
        assertThrows(MeetingEndedException.class, () -> meetings.awaitQuorum(meetingId, Duration.ofSeconds(5)));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        ender.get(5, TimeUnit.SECONDS);

        // Then
        assertTrue(elapsedMs < 4_000, "End must wake the waiter before the timeout, took " + elapsedMs + "ms");
        assertMeetingState(meetingId, MeetingState.ENDED);
    }

    @Test
    void testAwaitQuorum_NobodyJoins_TimeoutListsEveryRequiredAttendee() {
        // Given
        HumanParticipant human = registerHuman();
        AgentParticipant alpha = registerAgent("1", "Alpha");
        AgentParticipant beta = registerAgent("2", "Beta");
        MeetingId meetingId = meetings.openMeeting(human.id(), "Quiet",
            List.of(alpha.id(), beta.id()), List.of());

        // When
        MeetingTimeoutException timeout = assertThrows(MeetingTimeoutException.class,
            () -> meetings.awaitQuorum(meetingId, Duration.ofMillis(150)));

        // Then
        assertEquals(List.of(alpha.id(), beta.id()), timeout.missingAttendees());
        assertEquals(meetingId, timeout.meetingId());
    }

    @Test
    void testOpenMeeting_InviteeJoinsOnDelivery_StaysFormingUntilAllRequiredJoin() {
        // Given
        HumanParticipant human = registerHuman();
        RecordingParticipant eager = new RecordingParticipant(AgentId.of("1"), "Eager", false) {
            @Override
            public void deliver(Message message) {
                super.deliver(message);
                if (message.type() == MessageType.MEETING_INVITATION) {
                    meetings.joinMeeting(message.meetingId(), id());
                }
            }
        };
        router.register(eager);
        AgentParticipant beta = registerAgent("2", "Beta");

        // When
        MeetingId meetingId = meetings.openMeeting(human.id(), "Planning",
            List.of(eager.id(), beta.id()), List.of());

        // Then
        MeetingView view = meetings.findMeeting(meetingId).orElseThrow();
        assertEquals(MeetingState.FORMING, view.state(), "Beta has not joined yet");
        assertTrue(view.isJoined(eager.id()));
        assertEquals(List.of(beta.id()), view.missingRequired());

        meetings.joinMeeting(meetingId, beta.id());
        assertMeetingState(meetingId, MeetingState.ACTIVE);
    }

    private MeetingId awaitInvitation(AgentParticipant agent) {
        List<Message> batch = router.waitForMessages(agent.id(), "*", Duration.ofSeconds(2));
        return batch.stream()
            .filter(m -> m.type() == MessageType.MEETING_INVITATION)
            .map(Message::meetingId)
            .findFirst()
            .orElseThrow(() -> new AssertionError("No invitation for " + agent.id()));
    }
}
