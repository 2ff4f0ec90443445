package com.geevly.api;

import com.geevly.eventsourcing.AggregateRoot;

/**
 * Acknowledgement of an accepted command: the aggregate id and the version the caller should send
 * with its next command.
 */
public record CommandResult(String id, long version) {

    public static CommandResult of(AggregateRoot<?> aggregate) {
        return new CommandResult(aggregate.getId(), aggregate.getVersion());
    }
}
