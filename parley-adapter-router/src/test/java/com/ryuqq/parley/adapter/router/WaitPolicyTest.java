package com.ryuqq.parley.adapter.router;

import com.ryuqq.parley.adapter.inmemory.inbox.InMemoryInbox;
import com.ryuqq.parley.adapter.router.participant.AgentParticipant;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.AgentId;
import com.ryuqq.parley.core.model.MeetingId;
import com.ryuqq.parley.core.model.SourceSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * WaitPolicy 유닛 테스트.
 *
 * @author Parley Team
 * @since 1.0.0
 */
class WaitPolicyTest {

    private static final MeetingId MEETING = MeetingId.of("100");
    private static final AgentId OTHER = AgentId.of("2");

    private final ParleyConfig config = new ParleyConfig()
        .withWaitWindows(50, 400)
        .withDirectWaitMs(250)
        .withMaxBatchSize(10);

    private WaitPolicy policy;
    private AgentParticipant alpha;

    @BeforeEach
    void setUp() {
        policy = new WaitPolicy(config);
        alpha = new AgentParticipant(AgentId.of("1"), "Alpha", new InMemoryInbox("agent 1"));
    }

    @Test
    void windowFor_회의_외_출처는_한_건이면_반환() {
        // when
        WaitPolicy.Window window = policy.windowFor(alpha, SourceSpec.any(), null);

        // then
        assertThat(window.minItems()).isEqualTo(1);
        assertThat(window.maxItems()).isEqualTo(10);
        assertThat(window.waitTime()).isEqualTo(Duration.ofMillis(250));
        assertThat(window.targeted()).isFalse();
    }

    @Test
    void windowFor_회의_외_출처는_호출_측_시간_제한을_그대로_사용() {
        // when
        WaitPolicy.Window window = policy.windowFor(alpha, SourceSpec.of(OTHER), Duration.ofSeconds(3));

        // then
        assertThat(window.waitTime()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void windowFor_지목된_회의_메시지가_있으면_짧은_창() {
        // given
        alpha.deliver(Message.meetingBroadcast(OTHER, MEETING, "over to you", List.of(alpha.id())));

        // when
        WaitPolicy.Window window = policy.windowFor(alpha, SourceSpec.of(MEETING), null);

        // then
        assertThat(window.targeted()).isTrue();
        assertThat(window.waitTime()).isEqualTo(Duration.ofMillis(50));
        assertThat(window.minItems()).isEqualTo(10);
        assertThat(window.maxItems()).isEqualTo(10);
    }

    @Test
    void windowFor_지목되지_않았으면_긴_창() {
        // given
        alpha.deliver(Message.meetingBroadcast(OTHER, MEETING, "general remark", List.of()));

        // when
        WaitPolicy.Window window = policy.windowFor(alpha, SourceSpec.of(MEETING), null);

        // then
        assertThat(window.targeted()).isFalse();
        assertThat(window.waitTime()).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void windowFor_다른_회의의_지목은_무시() {
        // given
        alpha.deliver(Message.meetingBroadcast(OTHER, MeetingId.of("101"), "Alpha, elsewhere", List.of()));

        // when
        WaitPolicy.Window window = policy.windowFor(alpha, SourceSpec.of(MEETING), null);

        // then
        assertThat(window.targeted()).isFalse();
    }

    @Test
    void windowFor_호출_측_시간_제한이_창보다_짧으면_제한을_따름() {
        // when
        WaitPolicy.Window window = policy.windowFor(alpha, SourceSpec.of(MEETING), Duration.ofMillis(100));

        // then
        assertThat(window.waitTime()).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void windowFor_필터는_출처와_일치하는_메시지만_통과() {
        // when
        WaitPolicy.Window window = policy.windowFor(alpha, SourceSpec.of(MEETING), null);

        // then
        assertThat(window.filter().test(Message.meetingBroadcast(OTHER, MEETING, "in", List.of()))).isTrue();
        assertThat(window.filter().test(Message.direct(OTHER, alpha.id(), "out"))).isFalse();
    }
}
