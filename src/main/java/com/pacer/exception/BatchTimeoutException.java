package com.pacer.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Raised to a caller whose batch did not resolve within the configured maximum wait.
 */
@Getter
public class BatchTimeoutException extends RuntimeException {

    private final String batchKey;
    private final Duration maxWait;

    public BatchTimeoutException(String batchKey, Duration maxWait) {
        super("Batch '" + batchKey + "' did not complete within " + maxWait.toMillis() + "ms");
        this.batchKey = batchKey;
        this.maxWait = maxWait;
    }
}
