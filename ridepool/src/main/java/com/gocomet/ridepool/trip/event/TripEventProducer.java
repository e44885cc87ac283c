package com.gocomet.ridepool.trip.event;

import com.gocomet.ridepool.common.event.TripEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Publishes request and trip lifecycle events to the "trip-events" topic.
 * Sends are asynchronous; a failed send is logged and never fails the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripEventProducer {

    private final KafkaTemplate<String, TripEvent> kafkaTemplate;

    @Value("${app.kafka.topics.trip-events}")
    private String topic;

    public void publishRequested(UUID requestId) {
        publish(TripEvent.requested(requestId));
    }

    public void publishNoVehicle(UUID requestId) {
        publish(TripEvent.noVehicle(requestId, "No vehicle available"));
    }

    public void publishBooked(UUID tripId, UUID vehicleId, List<UUID> requestIds, BigDecimal basePrice) {
        String priceJson = String.format("{\"basePrice\": %.2f}", basePrice);
        publish(TripEvent.booked(tripId, vehicleId, requestIds, priceJson));
    }

    public void publishStarted(UUID tripId, UUID vehicleId, List<UUID> requestIds) {
        publish(TripEvent.started(tripId, vehicleId, requestIds));
    }

    public void publishCompleted(UUID tripId, UUID vehicleId, List<UUID> requestIds) {
        publish(TripEvent.completed(tripId, vehicleId, requestIds));
    }

    public void publishCancelled(UUID tripId, UUID vehicleId, List<UUID> requestIds, String reason) {
        publish(TripEvent.cancelled(tripId, vehicleId, requestIds, reason));
    }

    private void publish(TripEvent event) {
        String key = event.partitionKey();
        kafkaTemplate.send(topic, key, event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish TripEvent [{}] with key {}", event.getEventType(), key, ex);
                    } else {
                        log.info("Published TripEvent [{}] with key {} to partition {}, offset {}",
                                event.getEventType(),
                                key,
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    }
                });
    }
}
