package com.ryuqq.parley.core.model;

/**
 * 식별자 종류.
 *
 * <p>접두어 없는 식별자(예: {@code "1234"})를 해석할 때 호출 측 문맥으로 전달됩니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public enum IdKind {

    /**
     * 자율 에이전트.
     */
    AGENT("agent"),

    /**
     * 회의 (그룹 대화).
     */
    MEETING("meeting"),

    /**
     * 사람 참가자.
     */
    HUMAN("human");

    private final String prefix;

    IdKind(String prefix) {
        this.prefix = prefix;
    }

    /**
     * 정규 표기에서 사용하는 접두어.
     *
     * @return 접두어 (예: "agent")
     */
    public String prefix() {
        return prefix;
    }
}
