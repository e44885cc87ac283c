package com.gocomet.ridepool.vehicle.repository;

import com.gocomet.ridepool.vehicle.model.Vehicle;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface VehicleRepository extends JpaRepository<Vehicle, UUID> {

    long countByAvailableTrue();

    List<Vehicle> findAllByOrderByLicensePlateAsc();

    /**
     * Row-locks available vehicles that can carry the group, so two bookings never pick
     * the same one.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Vehicle v WHERE v.available = true " +
            "AND v.maxPassengers >= :passengers AND v.maxLuggageUnits >= :luggageUnits " +
            "ORDER BY v.createdAt ASC")
    List<Vehicle> findAvailableForUpdate(@Param("passengers") int passengers,
                                         @Param("luggageUnits") int luggageUnits,
                                         Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Vehicle v SET v.available = false, v.version = v.version + 1 " +
            "WHERE v.id = :id AND v.version = :version AND v.available = true")
    int reserve(@Param("id") UUID id, @Param("version") int version);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Vehicle v SET v.available = true, v.version = v.version + 1 " +
            "WHERE v.id = :id AND v.version = :version AND v.available = false")
    int release(@Param("id") UUID id, @Param("version") int version);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Vehicle v SET v.available = true, v.version = v.version + 1, " +
            "v.currentLat = :lat, v.currentLng = :lng " +
            "WHERE v.id = :id AND v.version = :version AND v.available = false")
    int releaseAt(@Param("id") UUID id, @Param("version") int version,
                  @Param("lat") double lat, @Param("lng") double lng);
}
