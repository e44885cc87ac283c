package com.gocomet.ridepool.vehicle.service;

import com.gocomet.ridepool.common.exception.ResourceNotFoundException;
import com.gocomet.ridepool.vehicle.dto.VehicleResponse;
import com.gocomet.ridepool.vehicle.model.Vehicle;
import com.gocomet.ridepool.vehicle.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class VehicleService {

    private final VehicleRepository vehicleRepository;

    public List<VehicleResponse> listVehicles() {
        return vehicleRepository.findAllByOrderByLicensePlateAsc().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    public VehicleResponse getVehicle(UUID vehicleId) {
        Vehicle vehicle = vehicleRepository.findById(vehicleId)
                .orElseThrow(() -> new ResourceNotFoundException("Vehicle", "id", vehicleId));
        return toResponse(vehicle);
    }

    private VehicleResponse toResponse(Vehicle vehicle) {
        return VehicleResponse.builder()
                .id(vehicle.getId())
                .licensePlate(vehicle.getLicensePlate())
                .driverName(vehicle.getDriverName())
                .maxPassengers(vehicle.getMaxPassengers())
                .maxLuggageUnits(vehicle.getMaxLuggageUnits())
                .currentLat(vehicle.getCurrentLat())
                .currentLng(vehicle.getCurrentLng())
                .available(vehicle.getAvailable())
                .build();
    }
}
