package com.nayem.tenancy.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cluster-wide lock on a Redis key with an expiry, so a crashed holder cannot
 * block reconciliation forever.
 * <p>
 * Each acquisition stores a fresh token as the key's value. Release deletes
 * the key only while it still holds that token, so a holder whose lock
 * expired cannot release a lock another instance has since taken.
 * </p>
 */
public class RedisReconciliationLock implements ReconciliationLock {

    private static final Logger log = LoggerFactory.getLogger(RedisReconciliationLock.class);

    static final String LOCK_PREFIX = "tenancy:reconciliation:lock:";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('DEL', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Map<String, String> heldTokens = new ConcurrentHashMap<>();

    public RedisReconciliationLock(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean acquireLock(String lockKey, long lockDurationMs) {
        String token = UUID.randomUUID().toString();
        Boolean success = redisTemplate.opsForValue()
                .setIfAbsent(LOCK_PREFIX + lockKey, token, Duration.ofMillis(lockDurationMs));
        if (Boolean.TRUE.equals(success)) {
            heldTokens.put(lockKey, token);
            return true;
        }
        return false;
    }

    @Override
    public void releaseLock(String lockKey) {
        String token = heldTokens.remove(lockKey);
        if (token == null) {
            log.debug("Lock {} is not held by this instance, nothing to release", lockKey);
            return;
        }
        Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(LOCK_PREFIX + lockKey), token);
        if (deleted == null || deleted == 0L) {
            log.warn("Lock {} expired before release and may now belong to another instance", lockKey);
        }
    }
}
