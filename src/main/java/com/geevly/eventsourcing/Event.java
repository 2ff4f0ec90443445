package com.geevly.eventsourcing;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable fact about one aggregate. {@code version} is the position of the event in the
 * aggregate's stream, starting at 1 for the creation event.
 */
public record Event(String type, String aggregateId, long version, Instant timestamp, byte[] payload) {

    public Event {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = payload == null ? new byte[0] : payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event other)) {
            return false;
        }
        return version == other.version
            && type.equals(other.type)
            && aggregateId.equals(other.aggregateId)
            && timestamp.equals(other.timestamp)
            && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, aggregateId, version, timestamp, Arrays.hashCode(payload));
    }

    @Override
    public String toString() {
        return "Event[" + type + " " + aggregateId + " v" + version + " @" + timestamp + "]";
    }
}
