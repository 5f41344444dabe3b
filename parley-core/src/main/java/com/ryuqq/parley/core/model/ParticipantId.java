package com.ryuqq.parley.core.model;

/**
 * 메시지를 직접 받을 수 있는 참가자의 식별자.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public sealed interface ParticipantId extends EntityId permits AgentId, HumanRef {

    /**
     * 사람 참가자인지 확인.
     *
     * @return {@link HumanRef}이면 true
     */
    default boolean isHuman() {
        return this instanceof HumanRef;
    }
}
