package com.flagship.gate_ledger.identity;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Redis fast-path for identity lookups on the scan hot path.
 *
 * Only identities that were found are cached, so a regNo registered after an
 * UNKNOWN scan is never hidden by a cached miss. Every Redis failure is
 * logged and treated as a cache miss; the database stays the source of truth.
 *
 * Writers evict through {@link #evictAfterCommit(String)}: a lookup running
 * before the commit would otherwise re-cache the old row.
 */
@Component
@Slf4j
public class IdentityLookupCache {

    private static final String REDIS_KEY_PREFIX = "identity:";
    private static final String FIELD_NAME = "name";
    private static final String FIELD_DEPARTMENT = "department";
    private static final String FIELD_TYPE = "type";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public IdentityLookupCache(Optional<StringRedisTemplate> redisTemplate,
                               @Value("${identity.cache.ttl:PT10M}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    public Optional<Identity> get(String regNo) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            Map<Object, Object> fields = redisTemplate.get().opsForHash().entries(REDIS_KEY_PREFIX + regNo);
            if (fields == null || fields.isEmpty()) {
                return Optional.empty();
            }
            Object type = fields.get(FIELD_TYPE);
            Object name = fields.get(FIELD_NAME);
            Object department = fields.get(FIELD_DEPARTMENT);
            if (type == null || name == null || department == null) {
                log.debug("Ignoring incomplete cache entry for {}", regNo);
                return Optional.empty();
            }
            log.debug("Identity cache hit: {}", regNo);
            return Optional.of(new Identity(regNo, name.toString(), department.toString(),
                IdentityType.valueOf(type.toString())));
        } catch (Exception e) {
            log.warn("Redis lookup failed for identity {}. Falling back to database. Error: {}",
                regNo, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(Identity identity) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        String key = REDIS_KEY_PREFIX + identity.getRegNo();
        Map<String, String> fields = new HashMap<>();
        fields.put(FIELD_NAME, identity.getName());
        fields.put(FIELD_DEPARTMENT, identity.getDepartment());
        fields.put(FIELD_TYPE, identity.getType().name());
        try {
            redisTemplate.get().opsForHash().putAll(key, fields);
            redisTemplate.get().expire(key, ttl);
        } catch (Exception e) {
            log.debug("Failed to cache identity {}: {}", identity.getRegNo(), e.getMessage());
        }
    }

    /**
     * Evicts once the surrounding transaction commits, or right away when no
     * transaction is active. Nothing is evicted on rollback.
     */
    public void evictAfterCommit(String regNo) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            evict(regNo);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                evict(regNo);
            }
        });
    }

    public void evict(String regNo) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().delete(REDIS_KEY_PREFIX + regNo);
        } catch (Exception e) {
            // Stale entry expires with the TTL
            log.warn("Failed to evict identity {} from Redis: {}", regNo, e.getMessage());
        }
    }
}
