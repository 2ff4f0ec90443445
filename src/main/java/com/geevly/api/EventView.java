package com.geevly.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.geevly.eventsourcing.Event;
import com.geevly.eventsourcing.PayloadCodec;

import java.time.Instant;

/**
 * A stored event as shown by the API, with its payload decoded to JSON.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventView(String type, String aggregateId, long version, Instant timestamp, JsonNode payload) {

    public static EventView of(Event event, PayloadCodec codec) {
        return new EventView(event.type(), event.aggregateId(), event.version(), event.timestamp(),
            codec.tree(event.payload()));
    }
}
