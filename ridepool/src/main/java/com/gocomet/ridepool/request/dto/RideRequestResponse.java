package com.gocomet.ridepool.request.dto;

import com.gocomet.ridepool.request.model.RequestSnapshot;
import com.gocomet.ridepool.request.model.RequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideRequestResponse {
    private UUID id;
    private UUID requesterId;
    private LocationDto pickup;
    private LocationDto dropoff;
    private Integer passengers;
    private List<Integer> luggage;
    private Integer maxDetourMinutes;
    private RequestStatus status;
    private Integer version;
    private LocalDateTime requestedAt;

    public static RideRequestResponse from(RequestSnapshot snapshot) {
        return RideRequestResponse.builder()
                .id(snapshot.getId())
                .requesterId(snapshot.getRequesterId())
                .pickup(new LocationDto(snapshot.getPickup().getLatitude(), snapshot.getPickup().getLongitude(),
                        snapshot.getPickup().getAddress()))
                .dropoff(new LocationDto(snapshot.getDropoff().getLatitude(), snapshot.getDropoff().getLongitude(),
                        snapshot.getDropoff().getAddress()))
                .passengers(snapshot.getPassengers())
                .luggage(snapshot.getLuggage())
                .maxDetourMinutes(snapshot.getMaxDetourMinutes())
                .status(snapshot.getStatus())
                .version(snapshot.getVersion())
                .requestedAt(snapshot.getRequestedAt())
                .build();
    }
}
