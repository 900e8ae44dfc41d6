package com.nayem.tenancy.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed implementation of {@link FailureLog}.
 * <p>
 * Records are kept as JSON in a Redis list, oldest first, plus one index key
 * per record so a record can be acknowledged by id. Index keys expire after the
 * configured TTL; the list entry stays until acknowledged.
 * </p>
 */
public class RedisFailureLog implements FailureLog {

    private static final Logger log = LoggerFactory.getLogger(RedisFailureLog.class);
    static final String LOG_KEY = "tenancy:failures";
    private static final String INDEX_KEY_PREFIX = "tenancy:failures:index:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration recordTtl;

    public RedisFailureLog(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Duration recordTtl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.recordTtl = recordTtl;
    }

    private String indexKey(String recordId) {
        return INDEX_KEY_PREFIX + recordId;
    }

    @Override
    public void record(FailureRecord record) {
        try {
            String json = objectMapper.writeValueAsString(toEnvelope(record));
            redisTemplate.opsForList().rightPush(LOG_KEY, json);
            redisTemplate.opsForValue().set(indexKey(record.id()), json, recordTtl);

            log.warn("Failure recorded in Redis: workflow={}, email={}, error={}, compensationSucceeded={}",
                    record.workflow(), record.email(), record.errorMessage(), record.compensationSucceeded());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize failure record {} ({}): {}",
                    record.id(), record.workflow(), record.errorMessage(), e);
        } catch (RuntimeException e) {
            log.error("Failed to write failure record {} to Redis ({}): {}",
                    record.id(), record.workflow(), record.errorMessage(), e);
        }
    }

    @Override
    public List<FailureRecord> list(int limit) {
        List<String> entries = redisTemplate.opsForList().range(LOG_KEY, 0, limit - 1);
        if (entries == null) {
            return List.of();
        }
        return entries.stream()
                .map(this::deserialize)
                .flatMap(Optional::stream)
                .toList();
    }

    @Override
    public void acknowledge(String recordId) {
        String json = redisTemplate.opsForValue().get(indexKey(recordId));
        if (json != null) {
            redisTemplate.opsForList().remove(LOG_KEY, 1, json);
            redisTemplate.delete(indexKey(recordId));
            log.info("Redis failure record acknowledged: id={}", recordId);
        }
    }

    @Override
    public long size() {
        Long size = redisTemplate.opsForList().size(LOG_KEY);
        return size != null ? size : 0;
    }

    private Optional<FailureRecord> deserialize(String json) {
        try {
            return Optional.of(fromEnvelope(objectMapper.readValue(json, FailureEnvelope.class)));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize failure record", e);
            return Optional.empty();
        }
    }

    private static FailureEnvelope toEnvelope(FailureRecord record) {
        return new FailureEnvelope(
                record.id(),
                record.workflow(),
                record.externalUserId(),
                record.externalOrgId(),
                record.email(),
                record.firstName(),
                record.lastName(),
                record.errorMessage(),
                record.errorClass(),
                record.compensationSucceeded(),
                record.occurredAt().toEpochMilli());
    }

    private static FailureRecord fromEnvelope(FailureEnvelope envelope) {
        return new FailureRecord(
                envelope.id(),
                envelope.workflow(),
                envelope.externalUserId(),
                envelope.externalOrgId(),
                envelope.email(),
                envelope.firstName(),
                envelope.lastName(),
                envelope.errorMessage(),
                envelope.errorClass(),
                envelope.compensationSucceeded(),
                Instant.ofEpochMilli(envelope.occurredAt()));
    }

    /**
     * Envelope for serializing failure records to Redis.
     */
    record FailureEnvelope(
            String id,
            String workflow,
            String externalUserId,
            String externalOrgId,
            String email,
            String firstName,
            String lastName,
            String errorMessage,
            String errorClass,
            boolean compensationSucceeded,
            long occurredAt) {
    }
}
