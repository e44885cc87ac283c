package com.gocomet.ridepool.request.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "ride_requests", indexes = {
        @Index(name = "idx_ride_requests_requester_id", columnList = "requester_id"),
        @Index(name = "idx_ride_requests_status_time", columnList = "status, requested_at"),
        @Index(name = "idx_ride_requests_pickup", columnList = "pickup_lat, pickup_lng")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RideRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "requester_id", nullable = false)
    private UUID requesterId;

    @Column(name = "pickup_lat", nullable = false)
    private Double pickupLat;

    @Column(name = "pickup_lng", nullable = false)
    private Double pickupLng;

    @Column(name = "pickup_address")
    private String pickupAddress;

    @Column(name = "dropoff_lat", nullable = false)
    private Double dropoffLat;

    @Column(name = "dropoff_lng", nullable = false)
    private Double dropoffLng;

    @Column(name = "dropoff_address")
    private String dropoffAddress;

    @Column(nullable = false)
    private Integer passengers;

    // One entry per bag: 1 = small, 2 = medium, 3 = large
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ride_request_luggage", joinColumns = @JoinColumn(name = "request_id"))
    @Column(name = "size_units", nullable = false)
    @Builder.Default
    private List<Integer> luggage = new ArrayList<>();

    @Column(name = "max_detour_minutes", nullable = false)
    @Builder.Default
    private Integer maxDetourMinutes = 15;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private RequestStatus status = RequestStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private Integer version = 1;

    @Column(name = "requested_at", nullable = false)
    private LocalDateTime requestedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
