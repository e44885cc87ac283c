package com.gocomet.ridepool.request.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocomet.ridepool.common.exception.ResourceNotFoundException;
import com.gocomet.ridepool.common.util.GeoUtils;
import com.gocomet.ridepool.request.dto.CreateRideRequest;
import com.gocomet.ridepool.request.dto.RideRequestResponse;
import com.gocomet.ridepool.request.model.RequestSnapshot;
import com.gocomet.ridepool.request.model.RequestStatus;
import com.gocomet.ridepool.request.model.RideRequest;
import com.gocomet.ridepool.request.repository.RideRequestRepository;
import com.gocomet.ridepool.trip.event.TripEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class RequestService {

    public static final double NEARBY_RADIUS_KM = 5.0;
    public static final int NEARBY_WINDOW_MINUTES = 10;
    public static final int NEARBY_LIMIT = 6;
    public static final int DEFAULT_MAX_DETOUR_MINUTES = 15;

    private static final String REQUEST_CACHE_PREFIX = "request:";

    private final RideRequestRepository rideRequestRepository;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final TripEventProducer tripEventProducer;
    private final Clock clock;

    @Value("${app.cache.request-ttl-seconds:60}")
    private long requestTtlSeconds;

    /**
     * Persist a new PENDING request and warm its cache entry.
     */
    @Transactional
    public RideRequestResponse createRequest(CreateRideRequest request) {
        RideRequest rideRequest = RideRequest.builder()
                .requesterId(request.getRequesterId())
                .pickupLat(request.getPickup().getLat())
                .pickupLng(request.getPickup().getLng())
                .pickupAddress(request.getPickup().getAddress())
                .dropoffLat(request.getDropoff().getLat())
                .dropoffLng(request.getDropoff().getLng())
                .dropoffAddress(request.getDropoff().getAddress())
                .passengers(request.getPassengers())
                .luggage(request.getLuggage() != null ? new ArrayList<>(request.getLuggage()) : new ArrayList<>())
                .maxDetourMinutes(request.getMaxDetourMinutes() != null
                        ? request.getMaxDetourMinutes()
                        : DEFAULT_MAX_DETOUR_MINUTES)
                .status(RequestStatus.PENDING)
                .requestedAt(LocalDateTime.now(clock))
                .build();

        rideRequest = rideRequestRepository.save(rideRequest);
        RequestSnapshot snapshot = RequestSnapshot.from(rideRequest);
        cache(snapshot);

        tripEventProducer.publishRequested(rideRequest.getId());
        log.info("Ride request {} created for requester {} ({} passengers, {} luggage units)",
                rideRequest.getId(), rideRequest.getRequesterId(),
                snapshot.getPassengers(), snapshot.luggageUnits());

        return RideRequestResponse.from(snapshot);
    }

    public RideRequestResponse getRequest(UUID requestId) {
        return RideRequestResponse.from(getSnapshot(requestId));
    }

    /**
     * Read-through lookup: cache first, then the store (which refills the cache).
     */
    public RequestSnapshot getSnapshot(UUID requestId) {
        String cached = redisTemplate.opsForValue().get(REQUEST_CACHE_PREFIX + requestId);
        if (cached != null) {
            try {
                RequestSnapshot snapshot = objectMapper.readValue(cached, RequestSnapshot.class);
                log.debug("Cache hit for request {}", requestId);
                return snapshot;
            } catch (JsonProcessingException e) {
                log.warn("Discarding unreadable cache entry for request {}: {}", requestId, e.getOriginalMessage());
            }
        }

        RideRequest rideRequest = rideRequestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride request", "id", requestId));
        RequestSnapshot snapshot = RequestSnapshot.from(rideRequest);
        cache(snapshot);
        return snapshot;
    }

    /**
     * Most recent PENDING requests whose pickup lies inside the search box around the
     * target's pickup. The target itself is never returned.
     */
    @Transactional(readOnly = true)
    public List<RequestSnapshot> findNearbyPending(RequestSnapshot target) {
        GeoUtils.BoundingBox box = GeoUtils.boundingBox(target.getPickup(), NEARBY_RADIUS_KM);
        LocalDateTime since = LocalDateTime.now(clock).minusMinutes(NEARBY_WINDOW_MINUTES);

        List<RideRequest> nearby = rideRequestRepository.findNearbyPending(
                RequestStatus.PENDING, target.getId(), since,
                box.getMinLat(), box.getMaxLat(), box.getMinLng(), box.getMaxLng(),
                PageRequest.of(0, NEARBY_LIMIT));

        log.debug("Found {} pending requests near {}", nearby.size(), target.getId());
        return nearby.stream()
                .map(RequestSnapshot::from)
                .collect(Collectors.toList());
    }

    /**
     * Gives up on a request nobody can serve: PENDING → CANCELLED.
     */
    @Transactional
    public void markNoVehicleAvailable(UUID requestId) {
        int updated = rideRequestRepository.advanceStatus(
                List.of(requestId), List.of(RequestStatus.PENDING), RequestStatus.CANCELLED);
        evict(List.of(requestId));
        if (updated == 0) {
            log.warn("Request {} left PENDING before it could be cancelled", requestId);
            return;
        }
        tripEventProducer.publishNoVehicle(requestId);
        log.warn("Request {} cancelled: no vehicle available", requestId);
    }

    public void evict(Collection<UUID> requestIds) {
        redisTemplate.delete(requestIds.stream()
                .map(id -> REQUEST_CACHE_PREFIX + id)
                .collect(Collectors.toList()));
    }

    private void cache(RequestSnapshot snapshot) {
        try {
            redisTemplate.opsForValue().set(REQUEST_CACHE_PREFIX + snapshot.getId(),
                    objectMapper.writeValueAsString(snapshot), requestTtlSeconds, TimeUnit.SECONDS);
        } catch (JsonProcessingException e) {
            log.warn("Could not cache request {}: {}", snapshot.getId(), e.getOriginalMessage());
        }
    }
}
