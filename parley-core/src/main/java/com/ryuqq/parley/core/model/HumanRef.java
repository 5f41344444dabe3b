package com.ryuqq.parley.core.model;

/**
 * 사람 참가자 식별자.
 *
 * <p>사람 한 명당 하나의 HumanRef가 대응됩니다. 기본 사람 참가자는
 * {@link #defaultHuman()}이며, 정규 표기는 {@code "human"}입니다.
 * 여러 사람이 참여하는 경우 {@code "human alice"}처럼 이름을 붙입니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class HumanRef implements ParticipantId {

    /**
     * 기본 사람 참가자 이름.
     */
    public static final String DEFAULT_NAME = "human";

    private static final HumanRef DEFAULT = new HumanRef(DEFAULT_NAME);

    private final String value;

    private HumanRef(String value) {
        this.value = IdentifierRules.requireValid("HumanRef", value);
    }

    /**
     * 기본 사람 참가자.
     *
     * @return 기본 HumanRef
     */
    public static HumanRef defaultHuman() {
        return DEFAULT;
    }

    /**
     * 이름으로 HumanRef 생성.
     *
     * @param name 사람 참가자 이름 (대소문자 구분 없이 "human"이면 기본 참가자)
     * @return HumanRef 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 이름인 경우
     */
    public static HumanRef of(String name) {
        if (name != null && DEFAULT_NAME.equalsIgnoreCase(name.trim())) {
            return DEFAULT;
        }
        return new HumanRef(name);
    }

    /**
     * 기본 사람 참가자인지 확인.
     *
     * @return 기본 참가자이면 true
     */
    public boolean isDefault() {
        return DEFAULT_NAME.equals(value);
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public IdKind kind() {
        return IdKind.HUMAN;
    }

    @Override
    public String format() {
        return isDefault() ? DEFAULT_NAME : DEFAULT_NAME + " " + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HumanRef other = (HumanRef) o;
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
