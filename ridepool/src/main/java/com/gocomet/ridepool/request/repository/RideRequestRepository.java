package com.gocomet.ridepool.request.repository;

import com.gocomet.ridepool.request.model.RequestStatus;
import com.gocomet.ridepool.request.model.RideRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface RideRequestRepository extends JpaRepository<RideRequest, UUID> {

    long countByStatus(RequestStatus status);

    /**
     * Recent requests in a lat/lng rectangle, newest first. Callers apply the exact
     * radius check themselves.
     */
    @Query("SELECT r FROM RideRequest r WHERE r.status = :status AND r.id <> :excludedId " +
            "AND r.requestedAt >= :since " +
            "AND r.pickupLat BETWEEN :minLat AND :maxLat " +
            "AND r.pickupLng BETWEEN :minLng AND :maxLng " +
            "ORDER BY r.requestedAt DESC")
    List<RideRequest> findNearbyPending(@Param("status") RequestStatus status,
                                        @Param("excludedId") UUID excludedId,
                                        @Param("since") LocalDateTime since,
                                        @Param("minLat") double minLat,
                                        @Param("maxLat") double maxLat,
                                        @Param("minLng") double minLng,
                                        @Param("maxLng") double maxLng,
                                        Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RideRequest r SET r.status = :next, r.version = r.version + 1 " +
            "WHERE r.id = :id AND r.version = :expectedVersion AND r.status = :expectedStatus")
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expectedVersion") int expectedVersion,
                            @Param("expectedStatus") RequestStatus expectedStatus,
                            @Param("next") RequestStatus next);

    /**
     * Moves every listed request whose status is one of {@code expectedStatuses}.
     * Returns how many rows moved; fewer than {@code ids.size()} means someone got there first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RideRequest r SET r.status = :next, r.version = r.version + 1 " +
            "WHERE r.id IN :ids AND r.status IN :expectedStatuses")
    int advanceStatus(@Param("ids") Collection<UUID> ids,
                      @Param("expectedStatuses") Collection<RequestStatus> expectedStatuses,
                      @Param("next") RequestStatus next);
}
