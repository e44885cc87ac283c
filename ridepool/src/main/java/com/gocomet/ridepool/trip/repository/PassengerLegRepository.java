package com.gocomet.ridepool.trip.repository;

import com.gocomet.ridepool.trip.model.PassengerLeg;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PassengerLegRepository extends JpaRepository<PassengerLeg, UUID> {
    List<PassengerLeg> findByTripIdOrderByPickupOrderAsc(UUID tripId);
}
