package com.gocomet.ridepool.common.exception;

import java.util.UUID;

public class MatchingInProgressException extends ConflictException {
    public MatchingInProgressException(UUID requestId) {
        super(String.format("Matching already in progress for request %s, please retry", requestId));
    }
}
