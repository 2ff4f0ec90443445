package com.geevly.eventsourcing;

/**
 * Wraps an unexpected runtime failure raised while an event handler mutated aggregate state.
 */
public class EventApplicationException extends DomainException {

    public EventApplicationException(Event event, Throwable cause) {
        super("failed to apply " + event.type() + " v" + event.version() + " to " + event.aggregateId()
            + ": " + cause.getMessage(), cause);
    }
}
