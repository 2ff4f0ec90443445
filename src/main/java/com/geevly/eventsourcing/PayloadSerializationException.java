package com.geevly.eventsourcing;

public class PayloadSerializationException extends DomainException {

    public PayloadSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
