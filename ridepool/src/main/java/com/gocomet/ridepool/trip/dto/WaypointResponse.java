package com.gocomet.ridepool.trip.dto;

import com.gocomet.ridepool.routing.model.WaypointType;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WaypointResponse {

    private WaypointType type;
    private UUID requestId;
    private Double lat;
    private Double lng;
    private String address;
}
