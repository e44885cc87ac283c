package com.gocomet.ridepool.vehicle.controller;

import com.gocomet.ridepool.vehicle.dto.VehicleResponse;
import com.gocomet.ridepool.vehicle.service.VehicleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/vehicles")
@RequiredArgsConstructor
public class VehicleController {

    private final VehicleService vehicleService;

    /**
     * GET /v1/vehicles — List the fleet with current availability
     */
    @GetMapping
    public ResponseEntity<List<VehicleResponse>> listVehicles() {
        return ResponseEntity.ok(vehicleService.listVehicles());
    }

    /**
     * GET /v1/vehicles/{id} — Get a single vehicle
     */
    @GetMapping("/{id}")
    public ResponseEntity<VehicleResponse> getVehicle(@PathVariable UUID id) {
        return ResponseEntity.ok(vehicleService.getVehicle(id));
    }
}
