package com.gocomet.ridepool.request.model;

/**
 * Lifecycle of a ride request. MATCHED is transient (a request with match options
 * that has not been booked yet) and is never persisted.
 */
public enum RequestStatus {
    PENDING,
    MATCHED,
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
