package com.gocomet.ridepool.vehicle.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VehicleResponse {
    private UUID id;
    private String licensePlate;
    private String driverName;
    private Integer maxPassengers;
    private Integer maxLuggageUnits;
    private Double currentLat;
    private Double currentLng;
    private Boolean available;
}
