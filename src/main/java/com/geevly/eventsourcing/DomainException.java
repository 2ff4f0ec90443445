package com.geevly.eventsourcing;

/**
 * Root of the failures raised by aggregates, repositories and services.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
