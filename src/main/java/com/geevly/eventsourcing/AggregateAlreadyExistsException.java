package com.geevly.eventsourcing;

public class AggregateAlreadyExistsException extends CommandValidationException {

    public AggregateAlreadyExistsException(String stream, String aggregateId) {
        super(stream + " already exists: " + aggregateId);
    }
}
