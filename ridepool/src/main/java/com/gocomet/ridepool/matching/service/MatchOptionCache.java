package com.gocomet.ridepool.matching.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocomet.ridepool.matching.model.MatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * The last options shown to a requester, so a booking can refer to one of them by index.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchOptionCache {

    private static final String MATCHES_PREFIX = "matches:";
    private static final TypeReference<List<MatchResult>> OPTIONS_TYPE = new TypeReference<>() {
    };

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${app.cache.match-ttl-seconds:60}")
    private long matchTtlSeconds;

    public void store(UUID requestId, List<MatchResult> options) {
        try {
            redisTemplate.opsForValue().set(MATCHES_PREFIX + requestId,
                    objectMapper.writeValueAsString(options), matchTtlSeconds, TimeUnit.SECONDS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize match options for request " + requestId, e);
        }
    }

    public Optional<List<MatchResult>> find(UUID requestId) {
        String json = redisTemplate.opsForValue().get(MATCHES_PREFIX + requestId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, OPTIONS_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable match options for request {}: {}", requestId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public void evict(UUID requestId) {
        redisTemplate.delete(MATCHES_PREFIX + requestId);
    }
}
