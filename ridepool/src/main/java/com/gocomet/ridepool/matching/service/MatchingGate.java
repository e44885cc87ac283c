package com.gocomet.ridepool.matching.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Caps how many match computations run at once. Callers over the cap wait in arrival
 * order instead of being rejected.
 */
@Component
@Slf4j
public class MatchingGate {

    private final Semaphore permits;
    private final int capacity;

    public MatchingGate(@Value("${app.matching.max-concurrent:100}") int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Matching concurrency must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    public <T> T execute(Supplier<T> work) {
        if (permits.availablePermits() == 0) {
            log.debug("Matching gate saturated ({} of {} in flight), {} callers already queued",
                    inFlight(), capacity(), queued());
        }
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a matching slot", e);
        }
        try {
            return work.get();
        } finally {
            permits.release();
        }
    }

    public int capacity() {
        return capacity;
    }

    public int inFlight() {
        return capacity - permits.availablePermits();
    }

    public int queued() {
        return permits.getQueueLength();
    }
}
