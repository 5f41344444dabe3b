package com.ryuqq.parley.core.statemachine;

/**
 * 회의 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>FORMING → ACTIVE</li>
 *   <li>FORMING → ENDED</li>
 *   <li>ACTIVE → ENDED</li>
 * </ul>
 *
 * <p>전이는 한 방향으로만 진행되며 ENDED에서 되살아나지 않습니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class MeetingTransition {

    private MeetingTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(MeetingState from, MeetingState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case FORMING -> to == MeetingState.ACTIVE || to == MeetingState.ENDED;
            case ACTIVE -> to == MeetingState.ENDED;
            case ENDED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static MeetingState transition(MeetingState current, MeetingState next) {
        validate(current, next);
        return next;
    }

    /**
     * 전이 가능 여부 확인 (예외 없이).
     */
    public static boolean canTransition(MeetingState from, MeetingState to) {
        try {
            validate(from, to);
            return true;
        } catch (IllegalStateException e) {
            return false;
        }
    }
}
