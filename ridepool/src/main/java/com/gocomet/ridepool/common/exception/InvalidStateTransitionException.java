package com.gocomet.ridepool.common.exception;

public class InvalidStateTransitionException extends ConflictException {
    public InvalidStateTransitionException(String entity, String currentState, String targetState) {
        super(String.format("Cannot transition %s from %s to %s", entity, currentState, targetState));
    }
}
