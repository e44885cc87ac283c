package com.gocomet.ridepool.request.controller;

import com.gocomet.ridepool.matching.model.MatchResult;
import com.gocomet.ridepool.matching.service.MatchingService;
import com.gocomet.ridepool.request.dto.CreateRideRequest;
import com.gocomet.ridepool.request.dto.RideRequestResponse;
import com.gocomet.ridepool.request.service.RequestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/requests")
@RequiredArgsConstructor
public class RequestController {

    private final RequestService requestService;
    private final MatchingService matchingService;

    /**
     * POST /v1/requests — Submit a ride request
     */
    @PostMapping
    public ResponseEntity<RideRequestResponse> createRequest(@Valid @RequestBody CreateRideRequest request) {
        RideRequestResponse response = requestService.createRequest(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * GET /v1/requests/{id} — Get request status
     */
    @GetMapping("/{id}")
    public ResponseEntity<RideRequestResponse> getRequest(@PathVariable UUID id) {
        return ResponseEntity.ok(requestService.getRequest(id));
    }

    /**
     * GET /v1/requests/{id}/matches — Ranked pooling options, solo first when nothing beats it
     */
    @GetMapping("/{id}/matches")
    public ResponseEntity<List<MatchResult>> findMatches(@PathVariable UUID id) {
        return ResponseEntity.ok(matchingService.findMatches(id));
    }
}
