package com.ryuqq.parley.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MeetingTransition 테스트.
 *
 * <p>허용되는 전이:</p>
 * <ul>
 *   <li>FORMING → ACTIVE</li>
 *   <li>FORMING → ENDED</li>
 *   <li>ACTIVE → ENDED</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
class MeetingTransitionTest {

    @Test
    void transition_FormingToActive_Succeeds() {
        assertEquals(MeetingState.ACTIVE, MeetingTransition.transition(MeetingState.FORMING, MeetingState.ACTIVE));
    }

    @Test
    void transition_FormingToEnded_Succeeds() {
        assertEquals(MeetingState.ENDED, MeetingTransition.transition(MeetingState.FORMING, MeetingState.ENDED));
    }

    @Test
    void transition_ActiveToEnded_Succeeds() {
        assertEquals(MeetingState.ENDED, MeetingTransition.transition(MeetingState.ACTIVE, MeetingState.ENDED));
    }

    @Test
    void transition_ActiveToForming_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> MeetingTransition.transition(MeetingState.ACTIVE, MeetingState.FORMING)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @ParameterizedTest
    @EnumSource(MeetingState.class)
    void transition_FromEnded_ThrowsException(MeetingState target) {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> MeetingTransition.transition(MeetingState.ENDED, target)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_NullStates_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> MeetingTransition.validate(null, MeetingState.ACTIVE));
        assertThrows(IllegalArgumentException.class, () -> MeetingTransition.validate(MeetingState.FORMING, null));
    }

    @Test
    void canTransition_ReportsWithoutThrowing() {
        assertTrue(MeetingTransition.canTransition(MeetingState.FORMING, MeetingState.ACTIVE));
        assertFalse(MeetingTransition.canTransition(MeetingState.FORMING, MeetingState.FORMING));
        assertFalse(MeetingTransition.canTransition(MeetingState.ENDED, MeetingState.ACTIVE));
    }

    @Test
    void isTerminal_OnlyEnded() {
        assertFalse(MeetingState.FORMING.isTerminal());
        assertFalse(MeetingState.ACTIVE.isTerminal());
        assertTrue(MeetingState.ENDED.isTerminal());
    }
}
