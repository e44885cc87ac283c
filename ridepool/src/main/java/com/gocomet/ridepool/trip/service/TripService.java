package com.gocomet.ridepool.trip.service;

import com.gocomet.ridepool.common.exception.ConcurrencyConflictException;
import com.gocomet.ridepool.common.exception.InvalidStateTransitionException;
import com.gocomet.ridepool.common.exception.ResourceNotFoundException;
import com.gocomet.ridepool.notification.service.NotificationService;
import com.gocomet.ridepool.request.model.RequestStatus;
import com.gocomet.ridepool.request.repository.RideRequestRepository;
import com.gocomet.ridepool.request.service.RequestService;
import com.gocomet.ridepool.trip.dto.TripResponse;
import com.gocomet.ridepool.trip.event.TripEventProducer;
import com.gocomet.ridepool.trip.model.PassengerLeg;
import com.gocomet.ridepool.trip.model.Trip;
import com.gocomet.ridepool.trip.model.TripStatus;
import com.gocomet.ridepool.trip.model.TripWaypoint;
import com.gocomet.ridepool.trip.repository.PassengerLegRepository;
import com.gocomet.ridepool.trip.repository.TripRepository;
import com.gocomet.ridepool.vehicle.model.Vehicle;
import com.gocomet.ridepool.vehicle.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class TripService {

    private static final List<RequestStatus> BOOKED_REQUEST_STATUSES =
            List.of(RequestStatus.CONFIRMED, RequestStatus.IN_PROGRESS);
    private static final List<TripStatus> ACTIVE_TRIP_STATUSES =
            List.of(TripStatus.CONFIRMED, TripStatus.IN_PROGRESS);

    private final TripRepository tripRepository;
    private final PassengerLegRepository passengerLegRepository;
    private final VehicleRepository vehicleRepository;
    private final RideRequestRepository rideRequestRepository;
    private final RequestService requestService;
    private final TripEventProducer tripEventProducer;
    private final NotificationService notificationService;

    /**
     * CONFIRMED → IN_PROGRESS. Member requests follow.
     */
    @Transactional
    public TripResponse startTrip(UUID tripId) {
        Trip trip = loadTrip(tripId);
        if (trip.getStatus() != TripStatus.CONFIRMED) {
            throw new InvalidStateTransitionException("Trip", trip.getStatus().name(), TripStatus.IN_PROGRESS.name());
        }
        UUID vehicleId = trip.getVehicle().getId();
        List<PassengerLeg> legs = passengerLegRepository.findByTripIdOrderByPickupOrderAsc(tripId);
        List<UUID> requestIds = requestIdsOf(legs);

        moveTrip(trip, TripStatus.IN_PROGRESS);
        moveRequests(requestIds, List.of(RequestStatus.CONFIRMED), RequestStatus.IN_PROGRESS);

        requestService.evict(requestIds);
        tripEventProducer.publishStarted(tripId, vehicleId, requestIds);
        notifyMembers(legs, "TRIP_STARTED", tripId);

        log.info("Trip {} started", tripId);
        return TripResponse.from(trip, vehicleId, legs);
    }

    /**
     * Frees the vehicle where it stands and puts every member request back to PENDING
     * so it can be matched again.
     */
    @Transactional
    public TripResponse cancelTrip(UUID tripId) {
        Trip trip = loadTrip(tripId);
        if (trip.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException("Trip", trip.getStatus().name(), TripStatus.CANCELLED.name());
        }
        Vehicle vehicle = trip.getVehicle();
        UUID vehicleId = vehicle.getId();
        int vehicleVersion = vehicle.getVersion();
        List<PassengerLeg> legs = passengerLegRepository.findByTripIdOrderByPickupOrderAsc(tripId);
        List<UUID> requestIds = requestIdsOf(legs);

        moveTrip(trip, TripStatus.CANCELLED);
        if (vehicleRepository.release(vehicleId, vehicleVersion) == 0) {
            throw new ConcurrencyConflictException("Vehicle", vehicleId);
        }
        moveRequests(requestIds, BOOKED_REQUEST_STATUSES, RequestStatus.PENDING);

        requestService.evict(requestIds);
        tripEventProducer.publishCancelled(tripId, vehicleId, requestIds, "Cancelled");
        notifyMembers(legs, "TRIP_CANCELLED", tripId);

        log.info("Trip {} cancelled, vehicle {} released, {} requests back to PENDING",
                tripId, vehicleId, requestIds.size());
        return TripResponse.from(trip, vehicleId, legs);
    }

    /**
     * Frees the vehicle at the final dropoff and completes every member request.
     */
    @Transactional
    public TripResponse completeTrip(UUID tripId) {
        Trip trip = loadTrip(tripId);
        if (trip.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException("Trip", trip.getStatus().name(), TripStatus.COMPLETED.name());
        }
        Vehicle vehicle = trip.getVehicle();
        UUID vehicleId = vehicle.getId();
        int vehicleVersion = vehicle.getVersion();
        TripWaypoint finalStop = trip.getWaypoints().get(trip.getWaypoints().size() - 1);
        List<PassengerLeg> legs = passengerLegRepository.findByTripIdOrderByPickupOrderAsc(tripId);
        List<UUID> requestIds = requestIdsOf(legs);

        moveTrip(trip, TripStatus.COMPLETED);
        if (vehicleRepository.releaseAt(vehicleId, vehicleVersion,
                finalStop.getLatitude(), finalStop.getLongitude()) == 0) {
            throw new ConcurrencyConflictException("Vehicle", vehicleId);
        }
        moveRequests(requestIds, BOOKED_REQUEST_STATUSES, RequestStatus.COMPLETED);

        requestService.evict(requestIds);
        tripEventProducer.publishCompleted(tripId, vehicleId, requestIds);
        notifyMembers(legs, "TRIP_COMPLETED", tripId);

        log.info("Trip {} completed, vehicle {} now at ({}, {})",
                tripId, vehicleId, finalStop.getLatitude(), finalStop.getLongitude());
        return TripResponse.from(trip, vehicleId, legs);
    }

    @Transactional(readOnly = true)
    public TripResponse getTrip(UUID tripId) {
        Trip trip = loadTrip(tripId);
        return TripResponse.from(trip, trip.getVehicle().getId(),
                passengerLegRepository.findByTripIdOrderByPickupOrderAsc(tripId));
    }

    /**
     * Active trips whose estimated end (creation time plus estimated duration) is before {@code now}.
     */
    @Transactional(readOnly = true)
    public List<UUID> findOverdueTripIds(LocalDateTime now) {
        return tripRepository.findByStatusIn(ACTIVE_TRIP_STATUSES).stream()
                .filter(trip -> trip.getCreatedAt()
                        .plusMinutes(trip.getEstimatedDurationMinutes())
                        .isBefore(now))
                .map(Trip::getId)
                .collect(Collectors.toList());
    }

    private Trip loadTrip(UUID tripId) {
        return tripRepository.findById(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip", "id", tripId));
    }

    private void moveTrip(Trip trip, TripStatus next) {
        int updated = tripRepository.compareAndSetStatus(trip.getId(), trip.getVersion(), trip.getStatus(), next);
        if (updated == 0) {
            throw new ConcurrencyConflictException("Trip", trip.getId());
        }
        trip.setStatus(next);
        trip.setVersion(trip.getVersion() + 1);
    }

    private void moveRequests(List<UUID> requestIds, List<RequestStatus> expected, RequestStatus next) {
        int updated = rideRequestRepository.advanceStatus(requestIds, expected, next);
        if (updated != requestIds.size()) {
            throw new ConcurrencyConflictException("Ride requests", requestIds);
        }
    }

    private List<UUID> requestIdsOf(List<PassengerLeg> legs) {
        return legs.stream().map(PassengerLeg::getRequestId).collect(Collectors.toList());
    }

    private void notifyMembers(List<PassengerLeg> legs, String eventType, UUID tripId) {
        notificationService.notifyRiders(
                legs.stream().map(PassengerLeg::getRequesterId).collect(Collectors.toList()),
                eventType, Map.of("tripId", tripId.toString()));
    }
}
