package com.nayem.tenancy.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory implementation of {@link FailureLog}.
 * <p>
 * Suitable for development, testing, and single-instance deployments.
 * Note: Records are lost on application restart.
 * </p>
 */
public class InMemoryFailureLog implements FailureLog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFailureLog.class);

    private final Queue<FailureRecord> queue = new ConcurrentLinkedQueue<>();
    private final Map<String, FailureRecord> recordsById = new ConcurrentHashMap<>();

    @Override
    public void record(FailureRecord record) {
        queue.offer(record);
        recordsById.put(record.id(), record);
        log.warn("Failure recorded: workflow={}, email={}, error={}, compensationSucceeded={}",
                record.workflow(), record.email(), record.errorMessage(), record.compensationSucceeded());
    }

    @Override
    public List<FailureRecord> list(int limit) {
        return queue.stream().limit(limit).toList();
    }

    @Override
    public void acknowledge(String recordId) {
        FailureRecord removed = recordsById.remove(recordId);
        if (removed != null) {
            queue.remove(removed);
            log.info("Failure record acknowledged: id={}", recordId);
        }
    }

    @Override
    public long size() {
        return queue.size();
    }

    /**
     * Clears all records (for testing).
     */
    public void clear() {
        queue.clear();
        recordsById.clear();
    }
}
