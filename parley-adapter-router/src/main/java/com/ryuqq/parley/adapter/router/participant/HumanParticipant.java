package com.ryuqq.parley.adapter.router.participant;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.model.HumanRef;
import com.ryuqq.parley.core.spi.Inbox;

/**
 * 사람 참가자.
 *
 * <p>전달 선호({@link DeliveryPreferences})는 실행 중에 바꿀 수 있습니다.
 * 점진 표시 여부만 선호를 따르며, 최종 메시지는 항상 받은편지함에 전달됩니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class HumanParticipant extends LocalParticipant {

    private volatile DeliveryPreferences preferences;

    public HumanParticipant(HumanRef id, Inbox inbox) {
        this(id, null, inbox, DeliveryPreferences.defaults());
    }

    public HumanParticipant(HumanRef id, String displayName, Inbox inbox, DeliveryPreferences preferences) {
        super(id, displayName, inbox);
        if (preferences == null) {
            throw new IllegalArgumentException("preferences cannot be null");
        }
        this.preferences = preferences;
    }

    @Override
    public HumanRef id() {
        return (HumanRef) super.id();
    }

    @Override
    public boolean supportsIncrementalDisplay() {
        return preferences.streamingEnabled();
    }

    public DeliveryPreferences preferences() {
        return preferences;
    }

    public void updatePreferences(DeliveryPreferences preferences) {
        if (preferences == null) {
            throw new IllegalArgumentException("preferences cannot be null");
        }
        this.preferences = preferences;
    }

    /**
     * 회의 발언을 이 사람에게 점진 표시할지 결정.
     *
     * <p>{@link MeetingNotifications#TARGETED}는 명시 대상과 본문 속 이름 언급을 모두 봅니다.
     * 다만 스트림 시작 시점에는 본문이 비어 있으므로 스트림에서는 명시 대상만 지목으로 인정됩니다.
     * 이름만 언급한 발언은 완료 후 최종 메시지로 받습니다.</p>
     *
     * @param message 회의 발언
     * @return 선호에 따라 표시하면 true
     */
    public boolean wantsMeetingStream(Message message) {
        DeliveryPreferences current = preferences;
        if (!current.streamingEnabled()) {
            return false;
        }
        return switch (current.meetingNotifications()) {
            case ALL -> true;
            case TARGETED -> AddressingRules.isAddressedTo(message, this);
            case NONE -> false;
        };
    }
}
