package com.geevly.eventsourcing;

public class NotFoundException extends DomainException {

    public NotFoundException(String message) {
        super(message);
    }
}
