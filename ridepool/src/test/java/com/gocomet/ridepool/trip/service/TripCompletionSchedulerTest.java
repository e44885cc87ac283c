package com.gocomet.ridepool.trip.service;

import com.gocomet.ridepool.common.exception.ConcurrencyConflictException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TripCompletionSchedulerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);

    @Mock
    private TripService tripService;

    @Test
    void conflictOnOneTripDoesNotStopTheSweep() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        UUID third = UUID.randomUUID();
        LocalDateTime now = LocalDateTime.now(CLOCK);
        when(tripService.findOverdueTripIds(now)).thenReturn(List.of(first, second, third));
        lenient().when(tripService.completeTrip(second)).thenThrow(new ConcurrencyConflictException("Trip", second));

        TripCompletionScheduler scheduler = new TripCompletionScheduler(tripService, CLOCK);

        assertEquals(2, scheduler.sweep(now));
        verify(tripService).completeTrip(first);
        verify(tripService).completeTrip(third);
    }

    @Test
    void scheduledRunUsesTheClock() {
        when(tripService.findOverdueTripIds(LocalDateTime.of(2026, 3, 2, 9, 0))).thenReturn(List.of());

        new TripCompletionScheduler(tripService, CLOCK).completeOverdueTrips();

        verify(tripService, never()).completeTrip(any());
    }
}
