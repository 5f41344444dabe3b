package com.ryuqq.parley.core.model;

/**
 * 라우팅 대상이 될 수 있는 모든 식별자의 공통 타입.
 *
 * <p>종류가 다르면 내부 문자열이 같아도 절대 같지 않습니다.
 * 예: {@code AgentId.of("42")}와 {@code MeetingId.of("42")}는 서로 다른 값입니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 종류가 컴파일 타임에 고정됩니다:</p>
 * <ul>
 *   <li>{@link ParticipantId} - 메시지를 받을 수 있는 참가자 ({@link AgentId}, {@link HumanRef})</li>
 *   <li>{@link MeetingId} - 회의</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public sealed interface EntityId permits ParticipantId, MeetingId {

    /**
     * 원시 식별자 값.
     *
     * @return 접두어를 제외한 값
     */
    String getValue();

    /**
     * 식별자 종류.
     *
     * @return 종류
     */
    IdKind kind();

    /**
     * 정규 표기.
     *
     * <p>{@link IdentifierParser#parse(String)}로 다시 파싱하면 동일한 값이 됩니다.</p>
     *
     * @return 정규 표기 (예: "agent 1234", "meeting 42", "human")
     */
    default String format() {
        return kind().prefix() + " " + getValue();
    }
}
