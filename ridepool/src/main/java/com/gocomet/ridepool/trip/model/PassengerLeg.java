package com.gocomet.ridepool.trip.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One request's ride inside a trip. {@code pickupOrder < dropoffOrder} always holds.
 */
@Entity
@Table(name = "passenger_legs", indexes = {
        @Index(name = "idx_passenger_legs_trip_id", columnList = "trip_id"),
        @Index(name = "idx_passenger_legs_request_id", columnList = "request_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PassengerLeg {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "trip_id", nullable = false)
    private Trip trip;

    @Column(name = "request_id", nullable = false)
    private UUID requestId;

    @Column(name = "requester_id", nullable = false)
    private UUID requesterId;

    @Column(nullable = false)
    private Integer passengers;

    @Column(name = "pickup_order", nullable = false)
    private Integer pickupOrder;

    @Column(name = "dropoff_order", nullable = false)
    private Integer dropoffOrder;

    @Column(precision = 10, scale = 2, nullable = false)
    private BigDecimal fare;

    @Column(name = "detour_minutes", nullable = false)
    private Integer detourMinutes;
}
