package com.ryuqq.parley.adapter.inmemory.inbox;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.AgentId;
import com.ryuqq.parley.core.model.HumanRef;
import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.ParticipantId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryInbox}.
 *
 * <p><strong>Covered behavior:</strong></p>
 * <ul>
 *   <li>Early release once {@code minItems} matches are buffered</li>
 *   <li>Release on a message satisfying {@code releaseNow}</li>
 *   <li>Timeout returns whatever matched, possibly nothing</li>
 *   <li>Non-matching messages stay buffered in arrival order</li>
 *   <li>Close wakes waiters and rejects further puts</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
class InMemoryInboxTest {

    private static final AgentId ALPHA = AgentId.of("1");
    private static final AgentId BETA = AgentId.of("2");
    private static final AgentId OWNER = AgentId.of("9");

    private InMemoryInbox inbox;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        inbox = new InMemoryInbox("agent 9");
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void getBatch_MessagesAlreadyBuffered_ReturnsWithoutWaiting() {
        // Given
        inbox.put(direct(ALPHA, "one"));
        inbox.put(direct(ALPHA, "two"));

        // When
        long startedAt = System.nanoTime();
        List<Message> batch = inbox.getBatch(m -> true, Duration.ofSeconds(5), 2, 10);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        // Then
        assertThat(batch).extracting(Message::content).containsExactly("one", "two");
        assertThat(elapsedMs).isLessThan(1_000);
        assertThat(inbox.size()).isZero();
    }

    @Test
    void getBatch_MaxItems_LeavesRemainderBuffered() {
        // Given
        inbox.put(direct(ALPHA, "one"));
        inbox.put(direct(ALPHA, "two"));
        inbox.put(direct(ALPHA, "three"));

        // When
        List<Message> batch = inbox.getBatch(m -> true, Duration.ZERO, 1, 2);

        // Then
        assertThat(batch).extracting(Message::content).containsExactly("one", "two");
        assertThat(inbox.snapshot()).extracting(Message::content).containsExactly("three");
    }

    @Test
    void getBatch_FilterExcludesMessages_NonMatchingStayInOrder() {
        // Given
        inbox.put(direct(ALPHA, "a1"));
        inbox.put(direct(BETA, "b1"));
        inbox.put(direct(ALPHA, "a2"));

        // When
        List<Message> fromBeta = inbox.getBatch(m -> m.sender().equals(BETA), Duration.ZERO, 1, 10);

        // Then
        assertThat(fromBeta).extracting(Message::content).containsExactly("b1");
        assertThat(inbox.snapshot()).extracting(Message::content).containsExactly("a1", "a2");
    }

    @Test
    void getBatch_NothingArrives_EmptyAfterTimeout() {
        // When
        long startedAt = System.nanoTime();
        List<Message> batch = inbox.getBatch(m -> true, Duration.ofMillis(150), 1, 10);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        // Then
        assertThat(batch).isEmpty();
        assertThat(elapsedMs).isGreaterThanOrEqualTo(100);
    }

    @Test
    void getBatch_TimeoutBeforeMinItems_ReturnsPartialBatch() {
        // Given
        inbox.put(direct(ALPHA, "only one"));

        // When
        List<Message> batch = inbox.getBatch(m -> true, Duration.ofMillis(100), 5, 10);

        // Then
        assertThat(batch).hasSize(1);
    }

    @Test
    void getBatch_HumanMessageArrives_DefaultReleaseEndsWait() throws Exception {
        // Given
        Future<List<Message>> waiting = executor.submit(
            () -> inbox.getBatch(m -> true, Duration.ofSeconds(5), 100, 100));
        Thread.sleep(50);

        // When
        long startedAt = System.nanoTime();
        inbox.put(direct(HumanRef.defaultHuman(), "stop and look"));
        List<Message> batch = waiting.get(5, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        // Then
        assertThat(batch).extracting(Message::content).containsExactly("stop and look");
        assertThat(elapsedMs).isLessThan(1_000);
    }

    @Test
    void 대기_중_메시지가_도착하면_즉시_깨어난다() throws Exception {
        // Given
        CountDownLatch waiting = new CountDownLatch(1);
        Future<List<Message>> result = executor.submit(() -> {
            waiting.countDown();
            return inbox.getBatch(m -> true, Duration.ofSeconds(5), 1, 10, m -> false);
        });
        waiting.await();
        Thread.sleep(50);

        // When
        inbox.put(direct(ALPHA, "wake up"));

        // Then
        assertThat(result.get(2, TimeUnit.SECONDS)).hasSize(1);
    }

    @Test
    void 여러_대기자가_서로_다른_필터로_메시지를_나눠_받는다() throws Exception {
        // Given
        Future<List<Message>> alphaWaiter = executor.submit(
            () -> inbox.getBatch(m -> m.sender().equals(ALPHA), Duration.ofSeconds(5), 1, 10, m -> false));
        Future<List<Message>> betaWaiter = executor.submit(
            () -> inbox.getBatch(m -> m.sender().equals(BETA), Duration.ofSeconds(5), 1, 10, m -> false));
        Thread.sleep(50);

        // When
        inbox.put(direct(BETA, "for beta waiter"));
        inbox.put(direct(ALPHA, "for alpha waiter"));

        // Then
        assertThat(alphaWaiter.get(2, TimeUnit.SECONDS)).extracting(Message::content)
            .containsExactly("for alpha waiter");
        assertThat(betaWaiter.get(2, TimeUnit.SECONDS)).extracting(Message::content)
            .containsExactly("for beta waiter");
        assertThat(inbox.size()).isZero();
    }

    @Test
    void peek_MatchingMessage_DoesNotRemove() {
        // Given
        inbox.put(Message.meetingBroadcast(ALPHA, MeetingId.of("100"), "hello", List.of(OWNER)));

        // When & Then
        assertThat(inbox.peek(m -> m.targets(OWNER))).isPresent();
        assertThat(inbox.peek(m -> m.targets(BETA))).isEmpty();
        assertThat(inbox.size()).isEqualTo(1);
    }

    @Test
    void close_WakesWaiterAndRejectsPut() throws Exception {
        // Given
        Future<List<Message>> waiting = executor.submit(
            () -> inbox.getBatch(m -> true, Duration.ofSeconds(5), 1, 10));
        Thread.sleep(50);

        // When
        inbox.close();

        // Then
        assertThat(waiting.get(2, TimeUnit.SECONDS)).isEmpty();
        assertThat(inbox.isClosed()).isTrue();
        assertThatThrownBy(() -> inbox.put(direct(ALPHA, "late")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("closed");
    }

    @Test
    void getBatch_InvalidArguments_ThrowException() {
        assertThatThrownBy(() -> inbox.getBatch(null, Duration.ZERO, 1, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> inbox.getBatch(m -> true, Duration.ofMillis(-1), 1, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> inbox.getBatch(m -> true, Duration.ZERO, 0, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> inbox.getBatch(m -> true, Duration.ZERO, 3, 2))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getBatch_InterruptedWhileWaiting_RestoresFlag() throws Exception {
        // Given
        Future<Boolean> interrupted = executor.submit(() -> {
            Thread.currentThread().interrupt();
            try {
                inbox.getBatch(m -> true, Duration.ofSeconds(5), 1, 1);
                return false;
            } catch (IllegalStateException e) {
                return Thread.currentThread().isInterrupted();
            }
        });

        // Then
        assertThat(interrupted.get(2, TimeUnit.SECONDS)).isTrue();
    }

    private static Message direct(ParticipantId sender, String content) {
        return Message.direct(sender, OWNER, content);
    }
}
