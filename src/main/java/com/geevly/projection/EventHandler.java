package com.geevly.projection;

import com.geevly.eventsourcing.Event;

/**
 * Refreshes the read side of one stream after an event has been stored.
 */
public interface EventHandler {

    String stream();

    void handle(Event event);
}
