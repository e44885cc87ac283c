package com.gocomet.ridepool.request.repository;

import com.gocomet.ridepool.request.model.RequestStatus;
import com.gocomet.ridepool.request.model.RideRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class RideRequestRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 8, 30);

    @Autowired
    private RideRequestRepository repository;

    // ========== Compare-and-set ==========

    @Test
    void casMovesOnlyFromExpectedVersionAndStatus() {
        RideRequest saved = repository.save(request(12.9352, 77.6245, NOW, RequestStatus.PENDING));

        assertEquals(1, repository.compareAndSetStatus(saved.getId(), 1, RequestStatus.PENDING, RequestStatus.CONFIRMED));
        assertEquals(0, repository.compareAndSetStatus(saved.getId(), 1, RequestStatus.PENDING, RequestStatus.CONFIRMED));
        assertEquals(0, repository.compareAndSetStatus(saved.getId(), 2, RequestStatus.PENDING, RequestStatus.CANCELLED));

        RideRequest reloaded = repository.findById(saved.getId()).orElseThrow();
        assertEquals(RequestStatus.CONFIRMED, reloaded.getStatus());
        assertEquals(2, reloaded.getVersion());
    }

    @Test
    void advanceStatusSkipsRowsInUnexpectedStatus() {
        RideRequest confirmed = repository.save(request(12.9352, 77.6245, NOW, RequestStatus.CONFIRMED));
        RideRequest pending = repository.save(request(12.9352, 77.6245, NOW, RequestStatus.PENDING));

        int moved = repository.advanceStatus(List.of(confirmed.getId(), pending.getId()),
                List.of(RequestStatus.CONFIRMED, RequestStatus.IN_PROGRESS), RequestStatus.IN_PROGRESS);

        assertEquals(1, moved);
        assertEquals(RequestStatus.IN_PROGRESS, repository.findById(confirmed.getId()).orElseThrow().getStatus());
        assertEquals(RequestStatus.PENDING, repository.findById(pending.getId()).orElseThrow().getStatus());
    }

    // ========== Nearby ==========

    @Test
    void nearbyFiltersByBoxWindowStatusAndExcludedId() {
        RideRequest target = repository.save(request(12.9352, 77.6245, NOW, RequestStatus.PENDING));
        RideRequest older = repository.save(request(12.9360, 77.6250, NOW.minusMinutes(8), RequestStatus.PENDING));
        RideRequest newer = repository.save(request(12.9340, 77.6240, NOW.minusMinutes(2), RequestStatus.PENDING));
        repository.save(request(12.9355, 77.6245, NOW.minusMinutes(15), RequestStatus.PENDING));
        repository.save(request(13.1986, 77.7066, NOW, RequestStatus.PENDING));
        repository.save(request(12.9352, 77.6245, NOW, RequestStatus.CONFIRMED));

        List<UUID> found = repository.findNearbyPending(RequestStatus.PENDING, target.getId(),
                        NOW.minusMinutes(10), 12.89, 12.98, 77.58, 77.67, PageRequest.of(0, 6))
                .stream()
                .map(RideRequest::getId)
                .collect(Collectors.toList());

        assertEquals(List.of(newer.getId(), older.getId()), found);
    }

    @Test
    void nearbyHonoursPageSize() {
        RideRequest target = repository.save(request(12.9352, 77.6245, NOW, RequestStatus.PENDING));
        for (int i = 1; i <= 8; i++) {
            repository.save(request(12.9352, 77.6245, NOW.minusMinutes(i), RequestStatus.PENDING));
        }

        assertEquals(6, repository.findNearbyPending(RequestStatus.PENDING, target.getId(),
                NOW.minusMinutes(10), 12.89, 12.98, 77.58, 77.67, PageRequest.of(0, 6)).size());
    }

    @Test
    void countsByStatus() {
        repository.save(request(12.9352, 77.6245, NOW, RequestStatus.PENDING));
        repository.save(request(12.9352, 77.6245, NOW, RequestStatus.PENDING));
        repository.save(request(12.9352, 77.6245, NOW, RequestStatus.COMPLETED));

        assertEquals(2, repository.countByStatus(RequestStatus.PENDING));
    }

    private RideRequest request(double pickupLat, double pickupLng, LocalDateTime requestedAt, RequestStatus status) {
        return RideRequest.builder()
                .requesterId(UUID.randomUUID())
                .pickupLat(pickupLat)
                .pickupLng(pickupLng)
                .dropoffLat(12.9716)
                .dropoffLng(77.5946)
                .passengers(1)
                .luggage(new ArrayList<>(List.of(1)))
                .status(status)
                .requestedAt(requestedAt)
                .build();
    }
}
