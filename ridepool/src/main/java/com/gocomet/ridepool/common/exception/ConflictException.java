package com.gocomet.ridepool.common.exception;

/**
 * Base type for expected, retryable conflicts: stale versions, leases held by
 * another caller, exhausted vehicle supply and unexpected lifecycle states.
 * Mapped to HTTP 409 by {@link GlobalExceptionHandler}.
 */
public abstract class ConflictException extends RuntimeException {

    protected ConflictException(String message) {
        super(message);
    }
}
