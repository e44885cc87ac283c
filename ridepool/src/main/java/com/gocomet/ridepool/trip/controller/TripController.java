package com.gocomet.ridepool.trip.controller;

import com.gocomet.ridepool.trip.dto.TripResponse;
import com.gocomet.ridepool.trip.service.TripService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/v1/trips")
@RequiredArgsConstructor
public class TripController {

    private final TripService tripService;

    /**
     * GET /v1/trips/{id} — Trip with its stops and legs
     */
    @GetMapping("/{id}")
    public ResponseEntity<TripResponse> getTrip(@PathVariable UUID id) {
        return ResponseEntity.ok(tripService.getTrip(id));
    }

    /**
     * POST /v1/trips/{id}/start — Vehicle picked up the first rider
     */
    @PostMapping("/{id}/start")
    public ResponseEntity<TripResponse> startTrip(@PathVariable UUID id) {
        return ResponseEntity.ok(tripService.startTrip(id));
    }

    /**
     * POST /v1/trips/{id}/cancel — Cancel and return riders to the matching pool
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<TripResponse> cancelTrip(@PathVariable UUID id) {
        return ResponseEntity.ok(tripService.cancelTrip(id));
    }

    /**
     * POST /v1/trips/{id}/complete — Finish the trip and free the vehicle
     */
    @PostMapping("/{id}/complete")
    public ResponseEntity<TripResponse> completeTrip(@PathVariable UUID id) {
        return ResponseEntity.ok(tripService.completeTrip(id));
    }
}
