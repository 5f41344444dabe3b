package com.ryuqq.parley.core.statemachine;

import com.ryuqq.parley.core.model.AgentId;
import com.ryuqq.parley.core.model.HumanRef;
import com.ryuqq.parley.core.model.MeetingId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MeetingInvitation 테스트.
 *
 * @author Parley Team
 * @since 1.0.0
 */
class MeetingInvitationTest {

    private final MeetingInvitation pending =
        MeetingInvitation.issue(MeetingId.of("100"), HumanRef.defaultHuman(), AgentId.of("1"), true);

    @Test
    void issue_NewInvitation_IsPending() {
        assertThat(pending.isPending()).isTrue();
        assertThat(pending.status()).isEqualTo(InvitationStatus.PENDING);
        assertThat(pending.required()).isTrue();
        assertThat(pending.respondedAt()).isNull();
    }

    @Test
    void resolve_Rejected_KeepsReasonAndTimestamp() {
        // When
        MeetingInvitation rejected = pending.resolve(InvitationStatus.REJECTED, "busy");

        // Then
        assertThat(rejected.status()).isEqualTo(InvitationStatus.REJECTED);
        assertThat(rejected.reason()).isEqualTo("busy");
        assertThat(rejected.respondedAt()).isNotNull();
        assertThat(rejected.status().isResolved()).isTrue();
        assertThat(pending.isPending()).as("original is unchanged").isTrue();
    }

    @Test
    void resolve_ToPending_ThrowsException() {
        assertThatThrownBy(() -> pending.resolve(InvitationStatus.PENDING, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolve_AlreadyResolved_ThrowsException() {
        MeetingInvitation joined = pending.resolve(InvitationStatus.JOINED, null);

        assertThatThrownBy(() -> joined.resolve(InvitationStatus.REJECTED, "changed my mind"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already resolved");
    }
}
