package com.incoresoft.presenceTracker.domain.shared.exception;

public class IdentityNotFoundException extends RuntimeException {
    public IdentityNotFoundException(String name) {
        super("Identity not found: " + name);
    }
}
