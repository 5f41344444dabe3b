package com.ryuqq.parley.adapter.router.participant;

import com.ryuqq.parley.core.model.AgentId;
import com.ryuqq.parley.core.spi.Inbox;

/**
 * 자율 에이전트 참가자. 점진 표시를 지원하지 않습니다.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class AgentParticipant extends LocalParticipant {

    /**
     * @param id 에이전트 ID
     * @param displayName 본문에서 부르는 이름 (예: "Planner"), null이면 ID 값
     * @param inbox 받은편지함
     */
    public AgentParticipant(AgentId id, String displayName, Inbox inbox) {
        super(id, displayName, inbox);
    }

    @Override
    public AgentId id() {
        return (AgentId) super.id();
    }
}
