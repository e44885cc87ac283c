package com.gocomet.ridepool.matching.service;

import com.gocomet.ridepool.common.exception.InvalidStateTransitionException;
import com.gocomet.ridepool.common.exception.MatchingInProgressException;
import com.gocomet.ridepool.matching.model.MatchResult;
import com.gocomet.ridepool.pricing.model.PricingSnapshot;
import com.gocomet.ridepool.pricing.service.SurgePricingService;
import com.gocomet.ridepool.request.model.RequestSnapshot;
import com.gocomet.ridepool.request.model.RequestStatus;
import com.gocomet.ridepool.request.service.RequestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * Runs the matching engine for one request under the concurrency gate and the
 * per-request lease.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchingService {

    private final MatchingGate matchingGate;
    private final MatchingLockService matchingLockService;
    private final RequestService requestService;
    private final SurgePricingService surgePricingService;
    private final MatchingEngine matchingEngine;
    private final MatchOptionCache matchOptionCache;
    private final Clock clock;

    /**
     * 1. Wait for a free matching slot
     * 2. Take the request's lease, failing fast if another match holds it
     * 3. Load the request and its pending neighbours
     * 4. Freeze surge and hour, run the engine
     * 5. Remember the options for booking
     */
    public List<MatchResult> findMatches(UUID requestId) {
        return matchingGate.execute(() -> matchUnderLease(requestId));
    }

    private List<MatchResult> matchUnderLease(UUID requestId) {
        String token = matchingLockService.tryAcquire(requestId)
                .orElseThrow(() -> new MatchingInProgressException(requestId));
        try {
            RequestSnapshot target = requestService.getSnapshot(requestId);
            if (target.getStatus() != RequestStatus.PENDING) {
                throw new InvalidStateTransitionException("Ride request", target.getStatus().name(),
                        RequestStatus.MATCHED.name());
            }

            List<RequestSnapshot> candidates = requestService.findNearbyPending(target);
            PricingSnapshot pricing = PricingSnapshot.builder()
                    .surgeFactor(surgePricingService.currentSurgeFactor())
                    .hourOfDay(LocalTime.now(clock).getHour())
                    .build();

            List<MatchResult> options = matchingEngine.findMatches(target, candidates, pricing);
            if (options.isEmpty()) {
                requestService.markNoVehicleAvailable(requestId);
                return options;
            }

            matchOptionCache.store(requestId, options);
            log.info("Request {} matched: {} options, best score {}",
                    requestId, options.size(), options.get(0).getScore());
            return options;
        } finally {
            matchingLockService.release(requestId, token);
        }
    }
}
