package com.ryuqq.parley.core.model;

import com.ryuqq.parley.core.message.Message;

import java.util.Optional;

/**
 * 메시지 대기 시 출처 필터.
 *
 * <p>모든 출처({@code "*"}), 특정 참가자가 보낸 메시지, 또는 특정 회의 문맥의 메시지를 선택합니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class SourceSpec {

    private static final SourceSpec ANY = new SourceSpec(null);

    private final EntityId source;

    private SourceSpec(EntityId source) {
        this.source = source;
    }

    public static SourceSpec any() {
        return ANY;
    }

    /**
     * 특정 출처로 필터 생성.
     *
     * @param source 참가자 또는 회의 식별자
     * @return SourceSpec
     * @throws IllegalArgumentException source가 null인 경우
     */
    public static SourceSpec of(EntityId source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return new SourceSpec(source);
    }

    public boolean isAny() {
        return source == null;
    }

    public Optional<EntityId> source() {
        return Optional.ofNullable(source);
    }

    /**
     * 회의 출처이면 해당 MeetingId.
     */
    public Optional<MeetingId> meetingId() {
        return source instanceof MeetingId ? Optional.of((MeetingId) source) : Optional.empty();
    }

    /**
     * 메시지가 이 출처에 해당하는지 확인.
     *
     * @param message 확인할 메시지
     * @return 일치하면 true
     */
    public boolean matches(Message message) {
        if (source == null) {
            return true;
        }
        if (source instanceof MeetingId) {
            return source.equals(message.meetingId());
        }
        return source.equals(message.sender());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceSpec other = (SourceSpec) o;
        return source == null ? other.source == null : source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return source == null ? 0 : source.hashCode();
    }

    @Override
    public String toString() {
        return source == null ? "*" : source.format();
    }
}
