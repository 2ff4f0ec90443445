package com.geevly.eventsourcing;

import java.util.List;
import java.util.Optional;

/**
 * Append-only log of events, partitioned into one stream per domain and one sequence per
 * aggregate inside a stream.
 */
public interface EventStore {

    /**
     * Appends all events or none. The first event must carry the stream's current version + 1 and
     * the rest must follow contiguously; anything else is a {@link VersionConflictException}.
     */
    void append(String stream, String aggregateId, List<Event> events);

    List<Event> load(String stream, String aggregateId);

    Optional<Event> loadVersion(String stream, String aggregateId, long version);

    long currentVersion(String stream, String aggregateId);

    List<String> aggregateIds(String stream);

    List<Event> query(String stream, Optional<String> type, Optional<String> aggregateId, int limit);
}
