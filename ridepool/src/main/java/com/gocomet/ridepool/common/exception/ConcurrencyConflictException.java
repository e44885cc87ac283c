package com.gocomet.ridepool.common.exception;

/**
 * A compare-and-swap update matched no row: someone else changed the record
 * between our read and our write.
 */
public class ConcurrencyConflictException extends ConflictException {

    public ConcurrencyConflictException(String entity, Object id) {
        super(String.format("%s %s was modified concurrently, please retry", entity, id));
    }

    public ConcurrencyConflictException(String entity, Object id, int expectedVersion, int actualVersion) {
        super(String.format("%s %s is at version %d, expected %d; please retry",
                entity, id, actualVersion, expectedVersion));
    }
}
