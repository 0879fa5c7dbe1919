package com.pacer.exception;

import lombok.Getter;

/**
 * Raised to every caller of a batch whose executor failed or returned a
 * result list that cannot be mapped back to the submitted items.
 */
@Getter
public class BatchExecutionException extends RuntimeException {

    private final String batchKey;

    public BatchExecutionException(String batchKey, String message) {
        super(message);
        this.batchKey = batchKey;
    }
}
