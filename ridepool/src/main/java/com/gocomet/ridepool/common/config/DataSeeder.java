package com.gocomet.ridepool.common.config;

import com.gocomet.ridepool.vehicle.model.Vehicle;
import com.gocomet.ridepool.vehicle.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Parks a small fleet around Bangalore on first start so requests have something to book.
 */
@Component
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

    private final VehicleRepository vehicleRepository;

    @Override
    public void run(String... args) {
        if (vehicleRepository.count() > 0) {
            log.info("Fleet already seeded. Skipping.");
            return;
        }

        log.info("Seeding vehicle fleet...");

        vehicleRepository.save(vehicle("KA01AB1001", "Raju", "+919800000001", 12.9352, 77.6245));   // Koramangala
        vehicleRepository.save(vehicle("KA01AB1002", "Kumar", "+919800000002", 12.9279, 77.6271));  // HSR Layout
        vehicleRepository.save(vehicle("KA01AB1003", "Suresh", "+919800000003", 12.9716, 77.5946)); // MG Road
        vehicleRepository.save(vehicle("KA01AB1004", "Venkat", "+919800000004", 12.9344, 77.6101)); // BTM Layout
        vehicleRepository.save(vehicle("KA01AB1005", "Anil", "+919800000005", 12.9784, 77.6408));   // Indiranagar

        // Roomier van at the airport
        vehicleRepository.save(Vehicle.builder()
                .licensePlate("KA01AB1006")
                .driverName("Mohan")
                .driverPhone("+919800000006")
                .maxPassengers(4)
                .maxLuggageUnits(8)
                .currentLat(13.1986)
                .currentLng(77.7066)
                .build());

        log.info("Seeded {} vehicles", vehicleRepository.count());
    }

    private Vehicle vehicle(String plate, String driver, String phone, double lat, double lng) {
        return Vehicle.builder()
                .licensePlate(plate)
                .driverName(driver)
                .driverPhone(phone)
                .currentLat(lat)
                .currentLng(lng)
                .build();
    }
}
