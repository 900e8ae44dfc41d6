package com.nayem.tenancy.audit;

import java.util.List;

/**
 * Durable log of workflow failures awaiting operator review.
 * <p>
 * Implementations should ensure durability and thread-safety.
 * </p>
 */
public interface FailureLog {

    /**
     * Appends a failure record. Must not throw: a failure to audit must never
     * mask the workflow error being audited.
     *
     * @param record The failure to log
     */
    void record(FailureRecord record);

    /**
     * Lists the oldest records first (for monitoring/admin purposes).
     *
     * @param limit Maximum number of records to return
     * @return A list of failure records
     */
    List<FailureRecord> list(int limit);

    /**
     * Marks a record as handled by an operator, removing it from the log.
     *
     * @param recordId The id of the record to acknowledge
     */
    void acknowledge(String recordId);

    /**
     * @return the number of unacknowledged records
     */
    long size();
}
