package com.gocomet.ridepool.trip.service;

import com.gocomet.ridepool.common.exception.ConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Completes trips that have outlived their estimated duration. Each trip commits in
 * its own transaction, so a trip that changed underneath us is skipped and the rest
 * of the sweep carries on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripCompletionScheduler {

    private final TripService tripService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.trips.completion-check-ms:60000}")
    public void completeOverdueTrips() {
        sweep(LocalDateTime.now(clock));
    }

    int sweep(LocalDateTime now) {
        List<UUID> overdue = tripService.findOverdueTripIds(now);
        int completed = 0;
        for (UUID tripId : overdue) {
            try {
                tripService.completeTrip(tripId);
                completed++;
            } catch (ConflictException e) {
                log.warn("Skipping overdue trip {}: {}", tripId, e.getMessage());
            }
        }
        if (!overdue.isEmpty()) {
            log.info("Auto-completed {} of {} overdue trips", completed, overdue.size());
        }
        return completed;
    }
}
