package com.ticketexchange.offer.service;

import java.time.Duration;

public interface DistributedLockService {

    /**
     * Acquire a distributed lock with automatic expiry
     *
     * @param lockKey The key for the lock
     * @param ttl Lock expiry, bounding how long a crashed holder blocks others
     * @return Lock token if successful, null if the lock is taken or Redis is unreachable
     */
    String acquireLock(String lockKey, Duration ttl);

    /**
     * Release a distributed lock
     *
     * @param lockKey The key for the lock
     * @param lockToken The token that was returned when acquiring the lock
     * @return true if successfully released, false otherwise
     */
    boolean releaseLock(String lockKey, String lockToken);

    /**
     * Run a task while holding a distributed lock, or skip it if another holder has the lock
     *
     * @return true if the task ran
     */
    boolean runWithLock(String lockKey, Duration ttl, Runnable task);

    /**
     * Lock key for the offer expiry sweep
     */
    static String expirySweepLock() {
        return "offer_expiry_sweep";
    }

    /**
     * Lock key for the capture reconciliation pass
     */
    static String captureReconciliationLock() {
        return "capture_reconciliation";
    }
}
