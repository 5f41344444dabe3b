package com.ryuqq.parley.testkit.contract;

import com.ryuqq.parley.adapter.inmemory.event.InMemoryEventBus;
import com.ryuqq.parley.adapter.inmemory.inbox.InMemoryInbox;
import com.ryuqq.parley.adapter.router.ParleyConfig;
import com.ryuqq.parley.adapter.router.ParleyRouter;
import com.ryuqq.parley.adapter.router.participant.AgentParticipant;
import com.ryuqq.parley.adapter.router.participant.DeliveryPreferences;
import com.ryuqq.parley.adapter.router.participant.HumanParticipant;
import com.ryuqq.parley.adapter.router.participant.LocalParticipant;
import com.ryuqq.parley.application.meeting.MeetingCoordinator;
import com.ryuqq.parley.application.meeting.MeetingView;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.AgentId;
import com.ryuqq.parley.core.model.HumanRef;
import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.statemachine.MeetingState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for Parley contract tests.
 *
 * <p>Every test gets a fresh {@link InMemoryEventBus} and {@link ParleyRouter}, configured with short
 * wait windows so timing scenarios finish quickly.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryEventBus: process-wide events</li>
 *   <li>ParleyRouter: participants, channels, streams, meetings</li>
 *   <li>ExecutorService: background participants (joins, rejections, waits)</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractParleyContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         HumanParticipant human = registerHuman();
 *         AgentParticipant planner = registerAgent("7", "Planner");
 *         router.routeMessage(human.id(), "agent 7", "hi", MessageType.DIRECT);
 *         assertEquals(1, planner.inbox().size());
 *     }
 * }
 * </pre>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public abstract class AbstractParleyContractTest {

    protected InMemoryEventBus eventBus;
    protected ParleyRouter router;
    protected MeetingCoordinator meetings;
    protected ExecutorService executor;

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUpParley() {
        eventBus = new InMemoryEventBus();
        router = new ParleyRouter(eventBus, config());
        meetings = router.meetings();
        executor = Executors.newCachedThreadPool();
    }

    /**
     * Cleans up test fixtures after each test.
     */
    @AfterEach
    void tearDownParley() throws InterruptedException {
        if (executor != null) {
            executor.shutdownNow();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (eventBus != null) {
            eventBus.clear();
        }
    }

    /**
     * Configuration used by the router under test.
     *
     * <p>Defaults: quorum 1000ms, targeted window 100ms, passive window 1500ms, direct wait 1000ms.</p>
     */
    protected ParleyConfig config() {
        return new ParleyConfig()
            .withQuorumTimeoutMs(1_000)
            .withWaitWindows(100, 1_500)
            .withDirectWaitMs(1_000);
    }

    protected AgentParticipant registerAgent(String id, String displayName) {
        AgentParticipant agent = new AgentParticipant(AgentId.of(id), displayName, new InMemoryInbox("agent " + id));
        router.register(agent);
        return agent;
    }

    protected HumanParticipant registerHuman() {
        HumanParticipant human = new HumanParticipant(HumanRef.defaultHuman(), new InMemoryInbox("human"));
        router.register(human);
        return human;
    }

    protected HumanParticipant registerHuman(String name, DeliveryPreferences preferences) {
        HumanRef ref = HumanRef.of(name);
        HumanParticipant human = new HumanParticipant(ref, name, new InMemoryInbox(ref.format()), preferences);
        router.register(human);
        return human;
    }

    /**
     * Removes and returns everything buffered in the participant's inbox without waiting.
     */
    protected List<Message> drain(LocalParticipant participant) {
        return participant.inbox().getBatch(m -> true, Duration.ZERO, 1, Integer.MAX_VALUE);
    }

    /**
     * Asserts the meeting is in the expected state.
     */
    protected void assertMeetingState(MeetingId meetingId, MeetingState expected) {
        MeetingView view = meetings.findMeeting(meetingId)
            .orElseThrow(() -> new AssertionError("No meeting " + meetingId));
        assertEquals(expected, view.state(),
            String.format("Expected meeting %s to be %s but was %s", meetingId.getValue(), expected, view.state()));
    }

    /**
     * Asserts that a snapshot contains a message with the given content.
     */
    protected void assertContainsContent(List<Message> messages, String content) {
        assertTrue(messages.stream().anyMatch(m -> m.content().equals(content)),
            String.format("Expected a message with content '%s' in %s", content, messages));
    }

    /**
     * Sleeps for the specified duration. Used to stage background participants in time.
     *
     * @param millis milliseconds to sleep
     */
    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Sleep interrupted", e);
        }
    }
}
