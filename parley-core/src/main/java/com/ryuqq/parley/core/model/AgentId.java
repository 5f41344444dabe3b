package com.ryuqq.parley.core.model;

/**
 * 자율 에이전트 식별자.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 마침표(.)만 허용</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class AgentId implements ParticipantId {

    private final String value;

    private AgentId(String value) {
        this.value = IdentifierRules.requireValid("AgentId", value);
    }

    /**
     * AgentId 생성.
     *
     * @param value 식별자 값 (접두어 제외)
     * @return AgentId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AgentId of(String value) {
        return new AgentId(value);
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public IdKind kind() {
        return IdKind.AGENT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AgentId other = (AgentId) o;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
