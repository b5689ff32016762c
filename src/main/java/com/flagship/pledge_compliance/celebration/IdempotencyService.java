package com.flagship.pledge_compliance.celebration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency-key lookups for pledge creation.
 *
 * Strategy:
 * 1. Redis first (fast, may be unavailable)
 * 2. Database unique key otherwise (source of truth)
 * 3. Redis is only written after the creating transaction commits, so a
 *    rolled-back pledge never leaves a cached key behind
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:celebration:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final CelebrationRepository celebrationRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(CelebrationRepository celebrationRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.celebrationRepository = celebrationRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the celebration already created under this key, if any
     */
    public Optional<UUID> findCelebrationId(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<UUID> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            return cached;
        }

        Optional<UUID> stored = celebrationRepository.findByIdempotencyKey(idempotencyKey)
                .map(CelebrationEntity::getId);
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            writeCache(idempotencyKey, id);
        });
        return stored;
    }

    /**
     * Caches the key once the surrounding transaction commits, or immediately
     * when called outside a transaction.
     */
    public void rememberAfterCommit(String idempotencyKey, UUID celebrationId) {
        requireKey(idempotencyKey);
        if (celebrationId == null) {
            throw new IllegalArgumentException("Celebration ID cannot be null");
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    writeCache(idempotencyKey, celebrationId);
                }
            });
        } else {
            writeCache(idempotencyKey, celebrationId);
        }
    }

    private Optional<UUID> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String idempotencyKey, UUID celebrationId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, celebrationId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
