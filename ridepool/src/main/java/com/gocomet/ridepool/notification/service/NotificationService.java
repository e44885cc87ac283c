package com.gocomet.ridepool.notification.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Push a request or trip update to one rider.
     * Frontend subscribes to: /topic/rider/{requesterId}
     */
    public void notifyRider(UUID requesterId, String eventType, Object payload) {
        String destination = "/topic/rider/" + requesterId;
        Map<String, Object> message = Map.of(
                "eventType", eventType,
                "payload", payload
        );
        messagingTemplate.convertAndSend(destination, (Object) message);
        log.debug("Notified rider {} with event: {}", requesterId, eventType);
    }

    public void notifyRiders(Collection<UUID> requesterIds, String eventType, Object payload) {
        requesterIds.forEach(requesterId -> notifyRider(requesterId, eventType, payload));
    }
}
