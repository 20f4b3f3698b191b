package com.aiide.backbone.core.pool;

import com.aiide.backbone.core.OperationTimeoutException;

import java.time.Duration;

/**
 * No entry became available within the acquire timeout and the pool is at
 * capacity. Returned to the caller for its own retry decision; the pool never
 * retries on its behalf.
 */
public class PoolExhaustedException extends OperationTimeoutException {

    private final String poolName;
    private final int maxSize;

    public PoolExhaustedException(String poolName, int maxSize, Duration timeout) {
        super("acquire from pool '" + poolName + "'", timeout,
                "Pool '" + poolName + "' exhausted: " + maxSize + " entries leased, waited " + timeout);
        this.poolName = poolName;
        this.maxSize = maxSize;
    }

    public String poolName() {
        return poolName;
    }

    public int maxSize() {
        return maxSize;
    }
}
