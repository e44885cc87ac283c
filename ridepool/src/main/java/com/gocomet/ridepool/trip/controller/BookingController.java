package com.gocomet.ridepool.trip.controller;

import com.gocomet.ridepool.trip.dto.BookingRequest;
import com.gocomet.ridepool.trip.dto.TripResponse;
import com.gocomet.ridepool.trip.service.BookingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    /**
     * POST /v1/bookings — Book one of the request's match options
     */
    @PostMapping
    public ResponseEntity<TripResponse> confirmBooking(@Valid @RequestBody BookingRequest request) {
        TripResponse response = bookingService.confirmBooking(request.getRequestId(), request.getOptionIndex());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
