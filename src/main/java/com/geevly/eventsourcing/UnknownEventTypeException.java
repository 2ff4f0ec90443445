package com.geevly.eventsourcing;

public class UnknownEventTypeException extends DomainException {

    public UnknownEventTypeException(String stream, String type) {
        super("unknown " + stream + " event type: " + type);
    }
}
