package com.geevly.eventsourcing;

/**
 * Hands out identifiers for aggregates that do not exist yet.
 */
public interface IdAllocator {

    long nextId(String type);
}
