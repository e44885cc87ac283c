package com.gocomet.ridepool.common.exception;

import java.util.UUID;

public class MatchOptionsExpiredException extends ConflictException {
    public MatchOptionsExpiredException(UUID requestId) {
        super(String.format("Match options for request %s have expired, request matches again", requestId));
    }
}
