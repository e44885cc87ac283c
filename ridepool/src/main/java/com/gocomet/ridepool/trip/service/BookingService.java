package com.gocomet.ridepool.trip.service;

import com.gocomet.ridepool.common.exception.ConcurrencyConflictException;
import com.gocomet.ridepool.common.exception.InvalidStateTransitionException;
import com.gocomet.ridepool.common.exception.MatchOptionsExpiredException;
import com.gocomet.ridepool.common.exception.NoVehicleAvailableException;
import com.gocomet.ridepool.common.exception.ResourceNotFoundException;
import com.gocomet.ridepool.matching.model.MatchResult;
import com.gocomet.ridepool.matching.model.PassengerLegPlan;
import com.gocomet.ridepool.matching.model.TripPlan;
import com.gocomet.ridepool.matching.service.MatchOptionCache;
import com.gocomet.ridepool.notification.service.NotificationService;
import com.gocomet.ridepool.request.model.RequestStatus;
import com.gocomet.ridepool.request.model.RideRequest;
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
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final RideRequestRepository rideRequestRepository;
    private final VehicleRepository vehicleRepository;
    private final TripRepository tripRepository;
    private final PassengerLegRepository passengerLegRepository;
    private final MatchOptionCache matchOptionCache;
    private final RequestService requestService;
    private final TripEventProducer tripEventProducer;
    private final NotificationService notificationService;

    /**
     * Book one of the options last returned by matching for this request.
     */
    @Transactional
    public TripResponse confirmBooking(UUID requestId, int optionIndex) {
        List<MatchResult> options = matchOptionCache.find(requestId)
                .orElseThrow(() -> new MatchOptionsExpiredException(requestId));
        if (optionIndex < 0 || optionIndex >= options.size()) {
            throw new IllegalArgumentException(String.format(
                    "Option %d does not exist, request %s has %d options", optionIndex, requestId, options.size()));
        }
        return confirmBooking(requestId, options.get(optionIndex));
    }

    /**
     * Turn a match option into a trip, all or nothing:
     * 1. Re-check the target request is still PENDING at the matched version
     * 2. Lock one free vehicle big enough for the group and reserve it
     * 3. Insert the trip and its legs
     * 4. Move every member request PENDING → CONFIRMED at its matched version
     * Any failure rolls the whole booking back.
     */
    @Transactional
    public TripResponse confirmBooking(UUID requestId, MatchResult option) {
        TripPlan plan = option.getPlan();
        PassengerLegPlan targetLeg = plan.getLegs().stream()
                .filter(leg -> leg.getRequestId().equals(requestId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Match option does not include request " + requestId));

        RideRequest target = rideRequestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride request", "id", requestId));
        if (target.getStatus() != RequestStatus.PENDING) {
            throw new InvalidStateTransitionException("Ride request", target.getStatus().name(),
                    RequestStatus.CONFIRMED.name());
        }
        if (target.getVersion() != targetLeg.getRequestVersion()) {
            throw new ConcurrencyConflictException("Ride request", requestId,
                    targetLeg.getRequestVersion(), target.getVersion());
        }

        List<Vehicle> candidates = vehicleRepository.findAvailableForUpdate(
                plan.getTotalPassengers(), plan.getTotalLuggageUnits(), PageRequest.of(0, 1));
        if (candidates.isEmpty()) {
            log.warn("No vehicle for request {} ({} passengers, {} luggage units)",
                    requestId, plan.getTotalPassengers(), plan.getTotalLuggageUnits());
            throw new NoVehicleAvailableException(plan.getTotalPassengers(), plan.getTotalLuggageUnits());
        }
        Vehicle vehicle = candidates.get(0);
        UUID vehicleId = vehicle.getId();
        if (vehicleRepository.reserve(vehicleId, vehicle.getVersion()) == 0) {
            throw new ConcurrencyConflictException("Vehicle", vehicleId);
        }

        Trip trip = Trip.builder()
                .vehicle(vehicleRepository.getReferenceById(vehicleId))
                .waypoints(plan.getWaypoints().stream()
                        .map(waypoint -> TripWaypoint.builder()
                                .type(waypoint.getType())
                                .requestId(waypoint.getRequestId())
                                .latitude(waypoint.getLocation().getLatitude())
                                .longitude(waypoint.getLocation().getLongitude())
                                .address(waypoint.getLocation().getAddress())
                                .build())
                        .collect(Collectors.toList()))
                .totalDistanceKm(BigDecimal.valueOf(plan.getTotalDistanceKm()).setScale(2, RoundingMode.HALF_UP))
                .estimatedDurationMinutes(plan.getEstimatedDurationMinutes())
                .basePrice(plan.getBasePrice())
                .surgeFactor(BigDecimal.valueOf(plan.getSurgeFactor()).setScale(2, RoundingMode.HALF_UP))
                .status(TripStatus.CONFIRMED)
                .build();
        trip = tripRepository.save(trip);

        Trip savedTrip = trip;
        List<PassengerLeg> legs = passengerLegRepository.saveAll(plan.getLegs().stream()
                .map(leg -> PassengerLeg.builder()
                        .trip(savedTrip)
                        .requestId(leg.getRequestId())
                        .requesterId(leg.getRequesterId())
                        .passengers(leg.getPassengers())
                        .pickupOrder(leg.getPickupOrder())
                        .dropoffOrder(leg.getDropoffOrder())
                        .fare(leg.getFare())
                        .detourMinutes(leg.getDetourMinutes())
                        .build())
                .collect(Collectors.toList()));

        for (PassengerLegPlan leg : plan.getLegs()) {
            int updated = rideRequestRepository.compareAndSetStatus(
                    leg.getRequestId(), leg.getRequestVersion(), RequestStatus.PENDING, RequestStatus.CONFIRMED);
            if (updated == 0) {
                throw new ConcurrencyConflictException("Ride request", leg.getRequestId());
            }
        }

        List<UUID> requestIds = plan.requestIds();
        requestService.evict(requestIds);
        requestIds.forEach(matchOptionCache::evict);

        tripEventProducer.publishBooked(trip.getId(), vehicleId, requestIds, trip.getBasePrice());
        notificationService.notifyRiders(
                legs.stream().map(PassengerLeg::getRequesterId).collect(Collectors.toList()),
                "TRIP_BOOKED", Map.of(
                        "tripId", trip.getId().toString(),
                        "vehicleId", vehicleId.toString(),
                        "licensePlate", vehicle.getLicensePlate(),
                        "estimatedDurationMinutes", trip.getEstimatedDurationMinutes()));

        log.info("Trip {} booked on vehicle {} for requests {} (base price {})",
                trip.getId(), vehicleId, requestIds, trip.getBasePrice());
        return TripResponse.from(trip, vehicleId, legs);
    }
}
