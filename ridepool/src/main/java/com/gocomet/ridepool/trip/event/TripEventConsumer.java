package com.gocomet.ridepool.trip.event;

import com.gocomet.ridepool.common.event.TripEvent;
import com.gocomet.ridepool.pricing.service.SurgePricingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Tracks trip lifecycle events. Any event that changes vehicle supply drops the cached
 * surge factor so the next match sees fresh demand/supply numbers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripEventConsumer {

    private final SurgePricingService surgePricingService;

    @KafkaListener(topics = "${app.kafka.topics.trip-events}", groupId = "trip-state-tracker")
    public void consume(
            @Payload TripEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        log.info("TripEvent [{}] tripId={}, requests={} | partition={}, offset={}",
                event.getEventType(),
                event.getTripId(),
                event.getRequestIds(),
                partition,
                offset);

        switch (event.getEventType()) {
            case REQUESTED -> log.debug("Request {} waiting for matching", event.getRequestId());
            case NO_VEHICLE -> log.warn("No vehicle for request {}: {}", event.getRequestId(), event.getMetadata());
            case BOOKED, COMPLETED, CANCELLED -> surgePricingService.invalidate();
            case STARTED -> log.debug("Trip {} started", event.getTripId());
        }
    }
}
