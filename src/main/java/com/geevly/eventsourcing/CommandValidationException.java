package com.geevly.eventsourcing;

/**
 * A command precondition failed. No event was produced and no state changed.
 */
public class CommandValidationException extends DomainException {

    public CommandValidationException(String message) {
        super(message);
    }
}
