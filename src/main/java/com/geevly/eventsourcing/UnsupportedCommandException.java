package com.geevly.eventsourcing;

public class UnsupportedCommandException extends DomainException {

    public UnsupportedCommandException(String message) {
        super(message);
    }
}
