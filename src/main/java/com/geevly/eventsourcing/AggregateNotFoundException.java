package com.geevly.eventsourcing;

public class AggregateNotFoundException extends NotFoundException {

    private final String stream;
    private final String aggregateId;

    public AggregateNotFoundException(String stream, String aggregateId) {
        super(stream + " not found: " + aggregateId);
        this.stream = stream;
        this.aggregateId = aggregateId;
    }

    public String getStream() {
        return stream;
    }

    public String getAggregateId() {
        return aggregateId;
    }
}
