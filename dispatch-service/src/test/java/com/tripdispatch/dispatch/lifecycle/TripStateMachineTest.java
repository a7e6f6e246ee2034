package com.tripdispatch.dispatch.lifecycle;

import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.shared.enums.TripStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TripStateMachineTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "PENDING, SEARCHING",
            "PENDING, SCHEDULED",
            "SCHEDULED, SEARCHING",
            "SEARCHING, ASSIGNED",
            "ASSIGNED, ARRIVED_PICKUP",
            "ARRIVED_PICKUP, IN_PROGRESS",
            "IN_PROGRESS, ARRIVED_DROPOFF",
            "ARRIVED_DROPOFF, COMPLETED"
    })
    @DisplayName("Forward edges of the lifecycle are allowed")
    void forwardEdgesAllowed(TripStatus from, TripStatus to) {
        assertThat(TripStateMachine.canTransition(from, to)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = TripStatus.class, names = {"COMPLETED", "CANCELLED"}, mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("Every non-terminal status can be cancelled")
    void everyNonTerminalStatusCanBeCancelled(TripStatus from) {
        assertThat(TripStateMachine.canTransition(from, TripStatus.CANCELLED)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = TripStatus.class, names = {"COMPLETED", "CANCELLED"})
    @DisplayName("Terminal statuses have no outgoing edges")
    void terminalStatusesAreClosed(TripStatus terminal) {
        assertThat(TripStateMachine.allowedFrom(terminal)).isEmpty();
    }

    @Test
    @DisplayName("Skipping a step is rejected with INVALID_TRANSITION")
    void skippingStepRejected() {
        assertThatThrownBy(() -> TripStateMachine.require(TripStatus.SEARCHING, TripStatus.IN_PROGRESS))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_TRANSITION);
    }

    @Test
    @DisplayName("Returning to SEARCHING is only possible through reassignment before pickup")
    void reassignmentOnlyBeforePickup() {
        assertThat(TripStateMachine.canTransition(TripStatus.ASSIGNED, TripStatus.SEARCHING)).isFalse();
        assertThat(TripStateMachine.canReassign(TripStatus.ASSIGNED)).isTrue();
        assertThat(TripStateMachine.canReassign(TripStatus.ARRIVED_PICKUP)).isTrue();
        assertThat(TripStateMachine.canReassign(TripStatus.IN_PROGRESS)).isFalse();

        assertThatThrownBy(() -> TripStateMachine.requireReassignment(TripStatus.IN_PROGRESS))
                .isInstanceOf(DispatchException.class);
    }
}
