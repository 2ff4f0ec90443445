package com.geevly.eventsourcing;

/**
 * Implemented by each domain's event-type enum. The wire name is what the store persists.
 */
public interface EventType {

    String getValue();

    Class<?> payloadType();
}
