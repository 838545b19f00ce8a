package com.medflow.backend.modules.tracking.domain;

/**
 * Transition function of the patient state machine. A {@code null} current status means the patient
 * has no tracking state yet for the date.
 */
public final class TrackingTransitions {

    private TrackingTransitions() {
    }

    /**
     * @param stationsRemaining only read for {@link TrackingAction#COMPLETE}: whether required stations
     *                          are left once the current one counts as done
     * @throws InvalidTransitionException for every pair outside the table
     */
    public static TrackingStatus next(TrackingStatus current, TrackingAction action, boolean stationsRemaining) {
        if (current == null) {
            return switch (action) {
                case ARRIVE -> TrackingStatus.WAITING;
                case ASSIGN -> TrackingStatus.MOVING;
                default -> throw InvalidTransitionException.of(null, action);
            };
        }
        return switch (current) {
            case WAITING -> switch (action) {
                case ARRIVE -> TrackingStatus.WAITING;
                case START -> TrackingStatus.IN_EXAM;
                case ASSIGN -> TrackingStatus.MOVING;
                default -> throw InvalidTransitionException.of(current, action);
            };
            case IN_EXAM -> switch (action) {
                case COMPLETE -> stationsRemaining ? TrackingStatus.MOVING : TrackingStatus.COMPLETED;
                case ASSIGN -> TrackingStatus.IN_EXAM;
                default -> throw InvalidTransitionException.of(current, action);
            };
            case MOVING -> switch (action) {
                case ARRIVE -> TrackingStatus.WAITING;
                case ASSIGN -> TrackingStatus.MOVING;
                default -> throw InvalidTransitionException.of(current, action);
            };
            case COMPLETED -> throw InvalidTransitionException.of(current, action);
        };
    }

    public static TrackingStatus next(TrackingStatus current, TrackingAction action) {
        return next(current, action, true);
    }
}
