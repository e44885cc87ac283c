package com.gocomet.ridepool.trip.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingRequest {

    @NotNull(message = "Request ID is required")
    private UUID requestId;

    // Position in the list returned by GET /v1/requests/{id}/matches
    @NotNull(message = "Option index is required")
    @Min(value = 0, message = "Option index cannot be negative")
    @Max(value = 4, message = "Option index is at most 4")
    private Integer optionIndex;
}
