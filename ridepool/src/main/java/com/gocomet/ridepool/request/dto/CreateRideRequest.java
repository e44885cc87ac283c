package com.gocomet.ridepool.request.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRideRequest {

    @NotNull(message = "Requester ID is required")
    private UUID requesterId;

    @NotNull(message = "Pickup is required")
    @Valid
    private LocationDto pickup;

    @NotNull(message = "Dropoff is required")
    @Valid
    private LocationDto dropoff;

    @NotNull(message = "Passengers is required")
    @Min(value = 1, message = "At least one passenger")
    @Max(value = 4, message = "At most four passengers")
    private Integer passengers;

    // 1 = small, 2 = medium, 3 = large
    @Size(max = 6, message = "At most six bags")
    @Builder.Default
    private List<@NotNull @Min(1) @Max(3) Integer> luggage = new ArrayList<>();

    @Min(value = 0, message = "Detour tolerance cannot be negative")
    @Max(value = 30, message = "Detour tolerance is at most 30 minutes")
    private Integer maxDetourMinutes;
}
