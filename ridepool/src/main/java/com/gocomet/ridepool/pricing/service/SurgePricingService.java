package com.gocomet.ridepool.pricing.service;

import com.gocomet.ridepool.request.model.RequestStatus;
import com.gocomet.ridepool.request.repository.RideRequestRepository;
import com.gocomet.ridepool.vehicle.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Citywide surge factor, recomputed from pending demand and free vehicles at most once
 * per cache period.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SurgePricingService {

    static final String SURGE_KEY = "surge:current";
    private static final int SURGE_TTL_SECONDS = 60;

    private final StringRedisTemplate redisTemplate;
    private final RideRequestRepository rideRequestRepository;
    private final VehicleRepository vehicleRepository;
    private final PricingEngine pricingEngine;

    public double currentSurgeFactor() {
        String cachedSurge = redisTemplate.opsForValue().get(SURGE_KEY);
        if (cachedSurge != null) {
            try {
                return Double.parseDouble(cachedSurge);
            } catch (NumberFormatException e) {
                log.warn("Ignoring unparsable surge value '{}' in cache", cachedSurge);
            }
        }

        long activeRequests = rideRequestRepository.countByStatus(RequestStatus.PENDING);
        long availableVehicles = vehicleRepository.countByAvailableTrue();
        double surge = pricingEngine.surgeFactor(activeRequests, availableVehicles);

        redisTemplate.opsForValue().set(SURGE_KEY, Double.toString(surge), SURGE_TTL_SECONDS, TimeUnit.SECONDS);
        log.debug("Surge recomputed: {} (pending: {}, available vehicles: {})",
                surge, activeRequests, availableVehicles);
        return surge;
    }

    public void invalidate() {
        redisTemplate.delete(SURGE_KEY);
        log.debug("Cached surge factor invalidated");
    }
}
