package com.gocomet.ridepool.matching.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Per-request matching lease held in Redis. Acquisition never blocks, and the key
 * expires on its own if the holder dies mid-match.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchingLockService {

    private static final String LOCK_PREFIX = "lock:matching:";

    // Delete only if we still own the key; an expired lease may already belong to someone else
    private static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    @Value("${app.matching.lock-ttl-seconds:10}")
    private long lockTtlSeconds;

    /**
     * Returns the owner token when the lease was taken, empty when someone else holds it.
     */
    public Optional<String> tryAcquire(UUID requestId) {
        String token = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(LOCK_PREFIX + requestId, token, lockTtlSeconds, TimeUnit.SECONDS);
        log.debug("Matching lease for request {}: {}", requestId, acquired);
        return Boolean.TRUE.equals(acquired) ? Optional.of(token) : Optional.empty();
    }

    public void release(UUID requestId, String token) {
        Long removed = redisTemplate.execute(RELEASE_SCRIPT, List.of(LOCK_PREFIX + requestId), token);
        if (removed == null || removed == 0L) {
            log.warn("Matching lease for request {} had already expired or changed owner", requestId);
        } else {
            log.debug("Released matching lease for request {}", requestId);
        }
    }
}
