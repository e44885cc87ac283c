package com.gocomet.ridepool.trip.model;

import com.gocomet.ridepool.vehicle.model.Vehicle;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "trips", indexes = {
        @Index(name = "idx_trips_vehicle_status", columnList = "vehicle_id, status"),
        @Index(name = "idx_trips_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Trip {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "vehicle_id", nullable = false)
    private Vehicle vehicle;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trip_waypoints", joinColumns = @JoinColumn(name = "trip_id"))
    @OrderColumn(name = "waypoint_order")
    @Builder.Default
    private List<TripWaypoint> waypoints = new ArrayList<>();

    @Column(name = "total_distance_km", precision = 10, scale = 2, nullable = false)
    private BigDecimal totalDistanceKm;

    @Column(name = "estimated_duration_minutes", nullable = false)
    private Integer estimatedDurationMinutes;

    // Sum of the legs' fares
    @Column(name = "base_price", precision = 10, scale = 2, nullable = false)
    private BigDecimal basePrice;

    @Column(name = "surge_factor", precision = 4, scale = 2, nullable = false)
    @Builder.Default
    private BigDecimal surgeFactor = BigDecimal.ONE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private TripStatus status = TripStatus.CONFIRMED;

    @Column(nullable = false)
    @Builder.Default
    private Integer version = 1;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
