package com.ryuqq.parley.adapter.router.participant;

import com.ryuqq.parley.adapter.inmemory.inbox.InMemoryInbox;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.AgentId;
import com.ryuqq.parley.core.model.HumanRef;
import com.ryuqq.parley.core.model.MeetingId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AddressingRules 및 사람 참가자의 회의 스트림 선호 테스트.
 *
 * @author Parley Team
 * @since 1.0.0
 */
class AddressingRulesTest {

    private static final MeetingId MEETING = MeetingId.of("100");
    private static final AgentId SPEAKER = AgentId.of("9");

    private final AgentParticipant alpha = new AgentParticipant(AgentId.of("1"), "Alpha", new InMemoryInbox("agent 1"));
    private final AgentParticipant beta = new AgentParticipant(AgentId.of("2"), "Beta", new InMemoryInbox("agent 2"));

    @Test
    void isAddressedTo_자기_메시지는_false() {
        Message own = Message.meetingBroadcast(alpha.id(), MEETING, "Alpha here", List.of(alpha.id()));

        assertThat(AddressingRules.isAddressedTo(own, alpha)).isFalse();
    }

    @Test
    void isAddressedTo_명시_대상이_있으면_본문_언급은_무시() {
        Message message = Message.meetingBroadcast(SPEAKER, MEETING, "Alpha, please review", List.of(beta.id()));

        assertThat(AddressingRules.isAddressedTo(message, beta)).isTrue();
        assertThat(AddressingRules.isAddressedTo(message, alpha)).isFalse();
    }

    @Test
    void isAddressedTo_이름_언급은_대소문자_무시() {
        Message message = Message.meetingBroadcast(SPEAKER, MEETING, "what do you think, ALPHA?", List.of());

        assertThat(AddressingRules.isAddressedTo(message, alpha)).isTrue();
        assertThat(AddressingRules.isAddressedTo(message, beta)).isFalse();
    }

    @Test
    void isAddressedTo_단어_일부는_언급이_아님() {
        Message message = Message.meetingBroadcast(SPEAKER, MEETING, "sort it in Alphabetical order", List.of());

        assertThat(AddressingRules.isAddressedTo(message, alpha)).isFalse();
    }

    @Test
    void isAddressedTo_ID_값_언급도_지목으로_인정() {
        AgentParticipant planner = new AgentParticipant(AgentId.of("planner7"), "Planner", new InMemoryInbox("p"));
        Message message = Message.meetingBroadcast(SPEAKER, MEETING, "planner7 owns this", List.of());

        assertThat(AddressingRules.isAddressedTo(message, planner)).isTrue();
    }

    @Test
    void mentions_빈_값은_false() {
        assertThat(AddressingRules.mentions("", "Alpha")).isFalse();
        assertThat(AddressingRules.mentions("Alpha", " ")).isFalse();
        assertThat(AddressingRules.mentions(null, "Alpha")).isFalse();
    }

    @Test
    void wantsMeetingStream_선호_수준에_따라_결정() {
        // given
        HumanParticipant human = new HumanParticipant(HumanRef.defaultHuman(), new InMemoryInbox("human"));
        Message general = Message.meetingBroadcast(SPEAKER, MEETING, "status update", List.of());
        Message targeted = Message.meetingBroadcast(SPEAKER, MEETING, "question", List.of(human.id()));

        // ALL
        assertThat(human.wantsMeetingStream(general)).isTrue();

        // TARGETED
        human.updatePreferences(DeliveryPreferences.defaults().withMeetingNotifications(MeetingNotifications.TARGETED));
        assertThat(human.wantsMeetingStream(general)).isFalse();
        assertThat(human.wantsMeetingStream(targeted)).isTrue();

        // NONE
        human.updatePreferences(DeliveryPreferences.defaults().withMeetingNotifications(MeetingNotifications.NONE));
        assertThat(human.wantsMeetingStream(targeted)).isFalse();

        // 점진 표시 비활성
        human.updatePreferences(DeliveryPreferences.defaults().withStreamingEnabled(false));
        assertThat(human.wantsMeetingStream(general)).isFalse();
        assertThat(human.supportsIncrementalDisplay()).isFalse();
    }
}
