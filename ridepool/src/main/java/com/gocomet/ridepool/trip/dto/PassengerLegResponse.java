package com.gocomet.ridepool.trip.dto;

import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PassengerLegResponse {

    private UUID requestId;
    private UUID requesterId;
    private Integer passengers;
    private Integer pickupOrder;
    private Integer dropoffOrder;
    private BigDecimal fare;
    private Integer detourMinutes;
}
