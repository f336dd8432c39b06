package com.caltrack.backend.common.tx;

/**
 * The persistence layer rejected a write. The surrounding transaction has been rolled back.
 */
public class StorageFailureException extends RuntimeException {

    public StorageFailureException(String code, Throwable cause) {
        super(code, cause);
    }
}
