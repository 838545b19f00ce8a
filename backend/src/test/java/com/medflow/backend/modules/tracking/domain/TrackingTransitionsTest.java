package com.medflow.backend.modules.tracking.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class TrackingTransitionsTest {

    @Test
    @DisplayName("an untracked patient can arrive or be assigned but not start or complete")
    void untrackedPatient() {
        assertThat(TrackingTransitions.next(null, TrackingAction.ARRIVE)).isEqualTo(TrackingStatus.WAITING);
        assertThat(TrackingTransitions.next(null, TrackingAction.ASSIGN)).isEqualTo(TrackingStatus.MOVING);
        assertThatThrownBy(() -> TrackingTransitions.next(null, TrackingAction.START))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("UNREGISTERED");
        assertThatThrownBy(() -> TrackingTransitions.next(null, TrackingAction.COMPLETE))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void waitingPatient() {
        assertThat(TrackingTransitions.next(TrackingStatus.WAITING, TrackingAction.ARRIVE)).isEqualTo(TrackingStatus.WAITING);
        assertThat(TrackingTransitions.next(TrackingStatus.WAITING, TrackingAction.START)).isEqualTo(TrackingStatus.IN_EXAM);
        assertThat(TrackingTransitions.next(TrackingStatus.WAITING, TrackingAction.ASSIGN)).isEqualTo(TrackingStatus.MOVING);
        assertThatThrownBy(() -> TrackingTransitions.next(TrackingStatus.WAITING, TrackingAction.COMPLETE))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessage("COMPLETE is not allowed while WAITING");
    }

    @Test
    @DisplayName("completing an exam moves on while stations remain and finishes the day otherwise")
    void inExamPatient() {
        assertThat(TrackingTransitions.next(TrackingStatus.IN_EXAM, TrackingAction.COMPLETE, true))
                .isEqualTo(TrackingStatus.MOVING);
        assertThat(TrackingTransitions.next(TrackingStatus.IN_EXAM, TrackingAction.COMPLETE, false))
                .isEqualTo(TrackingStatus.COMPLETED);
        assertThat(TrackingTransitions.next(TrackingStatus.IN_EXAM, TrackingAction.ASSIGN))
                .isEqualTo(TrackingStatus.IN_EXAM);
        assertThatThrownBy(() -> TrackingTransitions.next(TrackingStatus.IN_EXAM, TrackingAction.ARRIVE))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> TrackingTransitions.next(TrackingStatus.IN_EXAM, TrackingAction.START))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void movingPatient() {
        assertThat(TrackingTransitions.next(TrackingStatus.MOVING, TrackingAction.ARRIVE)).isEqualTo(TrackingStatus.WAITING);
        assertThat(TrackingTransitions.next(TrackingStatus.MOVING, TrackingAction.ASSIGN)).isEqualTo(TrackingStatus.MOVING);
        assertThatThrownBy(() -> TrackingTransitions.next(TrackingStatus.MOVING, TrackingAction.START))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> TrackingTransitions.next(TrackingStatus.MOVING, TrackingAction.COMPLETE))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @ParameterizedTest
    @EnumSource(TrackingAction.class)
    @DisplayName("a completed patient accepts no further action")
    void completedIsTerminal(TrackingAction action) {
        assertThatThrownBy(() -> TrackingTransitions.next(TrackingStatus.COMPLETED, action, true))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(ex -> assertThat(((InvalidTransitionException) ex).getCode()).isEqualTo("INVALID_TRANSITION"));
    }
}
