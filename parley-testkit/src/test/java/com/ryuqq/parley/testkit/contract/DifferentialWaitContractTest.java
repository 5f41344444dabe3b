package com.ryuqq.parley.testkit.contract;

import com.ryuqq.parley.adapter.router.participant.AgentParticipant;
import com.ryuqq.parley.adapter.router.participant.HumanParticipant;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.message.MessageType;
import com.ryuqq.parley.core.model.MeetingId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for differential waiting in meetings.
 *
 * <p>A participant addressed by a pending meeting message waits only the short targeted window,
 * everyone else waits the passive window so replies can accumulate. A human message ends any
 * wait at once.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Human broadcast → waiting agent released immediately</li>
 *   <li>Message targeting the waiter → targeted window</li>
 *   <li>Untargeted message → full passive window, everything collected</li>
 *   <li>Name mention without explicit targets → targeted window</li>
 *   <li>Message arriving before the wait starts → returned, no lost wakeup</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
class DifferentialWaitContractTest extends AbstractParleyContractTest {

    private HumanParticipant human;
    private AgentParticipant alpha;
    private AgentParticipant beta;
    private MeetingId meetingId;

    @BeforeEach
    void setUpMeeting() {
        human = registerHuman();
        alpha = registerAgent("1", "Alpha");
        beta = registerAgent("2", "Beta");
        meetingId = meetings.openMeeting(human.id(), "Standup", List.of(alpha.id(), beta.id()), List.of());
        meetings.joinMeeting(meetingId, alpha.id());
        meetings.joinMeeting(meetingId, beta.id());
        drain(human);
        drain(alpha);
        drain(beta);
    }

    @Test
    void testWait_HumanBroadcastArrives_ReleasedImmediately() throws Exception {
        // Given
        Future<List<Message>> waiting = executor.submit(
            () -> router.waitForMessages(alpha.id(), meetingSource(), Duration.ofSeconds(5)));
        sleep(50);

        // When
        long startedAt = System.nanoTime();
        router.routeMessage(human.id(), meetingSource(), "quick question", MessageType.MEETING_BROADCAST);
        List<Message> batch = waiting.get(5, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        // Then
        assertContainsContent(batch, "quick question");
        assertTrue(elapsedMs < 1_000, "Human message must end the wait early, took " + elapsedMs + "ms");
    }

    @Test
    void testWait_PendingMessageTargetsWaiter_TargetedWindow() {
        // Given
        meetings.broadcast(meetingId, beta.id(), "can you check the build?", List.of(alpha.id()));

        // When
        long startedAt = System.nanoTime();
        List<Message> batch = router.waitForMessages(alpha.id(), meetingSource(), Duration.ofSeconds(5));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        // Then
        assertContainsContent(batch, "can you check the build?");
        assertTrue(elapsedMs < 1_000, "Targeted wait uses the short window, took " + elapsedMs + "ms");
    }

    @Test
    void testWait_NameMentionWithoutTargets_TargetedWindow() {
        // Given
        meetings.broadcast(meetingId, beta.id(), "Alpha, what do you think?", List.of());

        // When
        long startedAt = System.nanoTime();
        List<Message> batch = router.waitForMessages(alpha.id(), meetingSource(), Duration.ofSeconds(5));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        // Then
        assertEquals(1, batch.size());
        assertTrue(elapsedMs < 1_000, "Mention counts as addressing, took " + elapsedMs + "ms");
    }

    @Test
    void testWait_UntargetedMessages_PassiveWindowCollectsLateReplies() throws Exception {
        // Given
        meetings.broadcast(meetingId, beta.id(), "build is green", List.of());
        Future<?> lateReply = executor.submit(() -> {
            sleep(300);
            meetings.broadcast(meetingId, beta.id(), "deploying now", List.of());
        });

        // When
        long startedAt = System.nanoTime();
        List<Message> batch = router.waitForMessages(alpha.id(), meetingSource(), Duration.ofSeconds(5));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        lateReply.get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(2, batch.size(), "Passive wait collects replies arriving inside the window");
        assertTrue(elapsedMs >= 1_300, "Passive wait lasts the passive window, took " + elapsedMs + "ms");
    }

    @Test
    void testWait_ExplicitTargetsElsewhere_MentionIgnored() {
        // Given
        meetings.broadcast(meetingId, beta.id(), "Alpha already reviewed this", List.of(human.id()));

        // When
        long startedAt = System.nanoTime();
        List<Message> batch = router.waitForMessages(alpha.id(), meetingSource(), Duration.ofMillis(600));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        // Then
        assertEquals(1, batch.size());
        assertTrue(elapsedMs >= 500, "Explicit targets decide addressing, took " + elapsedMs + "ms");
    }

    @Test
    void testWait_DirectMessageBeforeWait_NoLostWakeup() {
        // Given
        router.routeMessage(beta.id(), "agent 1", "sent before you listened", MessageType.DIRECT);

        // When
        List<Message> batch = router.waitForMessages(alpha.id(), "agent 2", Duration.ofSeconds(1));

        // Then
        assertEquals(1, batch.size());
        assertEquals("sent before you listened", batch.get(0).content());
    }

    @Test
    void testWait_SourceFilter_NonMatchingMessagesStayQueued() {
        // Given
        router.routeMessage(human.id(), "agent 1", "from the human", MessageType.DIRECT);
        router.routeMessage(beta.id(), "agent 1", "from beta", MessageType.DIRECT);

        // When
        List<Message> fromBeta = router.waitForMessages(alpha.id(), "agent 2", Duration.ofSeconds(1));

        // Then
        assertEquals(1, fromBeta.size());
        assertEquals("from beta", fromBeta.get(0).content());
        assertEquals(1, alpha.inbox().size(), "Human message must stay queued");
        assertContainsContent(router.waitForMessages(alpha.id(), "human", Duration.ofSeconds(1)), "from the human");
    }

    @Test
    void testWait_NothingArrives_EmptyAfterTimeout() {
        // When
        List<Message> batch = router.waitForMessages(alpha.id(), "agent 2", Duration.ofMillis(100));

        // Then
        assertTrue(batch.isEmpty());
    }

    private String meetingSource() {
        return "meeting " + meetingId.getValue();
    }
}
