package com.gocomet.ridepool.trip.repository;

import com.gocomet.ridepool.trip.model.Trip;
import com.gocomet.ridepool.trip.model.TripStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface TripRepository extends JpaRepository<Trip, UUID> {

    List<Trip> findByStatusIn(Collection<TripStatus> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Trip t SET t.status = :next, t.version = t.version + 1 " +
            "WHERE t.id = :id AND t.version = :expectedVersion AND t.status = :expectedStatus")
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expectedVersion") int expectedVersion,
                            @Param("expectedStatus") TripStatus expectedStatus,
                            @Param("next") TripStatus next);
}
