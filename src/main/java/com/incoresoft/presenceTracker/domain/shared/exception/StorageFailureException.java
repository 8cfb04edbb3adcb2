package com.incoresoft.presenceTracker.domain.shared.exception;

public class StorageFailureException extends RuntimeException {
    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
