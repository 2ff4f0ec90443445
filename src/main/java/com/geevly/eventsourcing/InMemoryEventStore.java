package com.geevly.eventsourcing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Event store held in memory, used for replay checks and aggregate tests.
 */
public class InMemoryEventStore implements EventStore {

    private record StoredEvent(String stream, long sequence, Event event) {}

    private final CopyOnWriteArrayList<StoredEvent> events = new CopyOnWriteArrayList<>();
    private long sequence;

    @Override
    public synchronized void append(String stream, String aggregateId, List<Event> batch) {
        long expected = currentVersion(stream, aggregateId) + 1;
        for (Event event : batch) {
            if (!aggregateId.equals(event.aggregateId())) {
                throw new IllegalArgumentException("event for " + event.aggregateId() + " appended to " + aggregateId);
            }
            if (event.version() != expected) {
                throw new VersionConflictException(aggregateId, event.version() - 1, expected - 1);
            }
            expected++;
        }
        List<StoredEvent> stored = new ArrayList<>(batch.size());
        for (Event event : batch) {
            stored.add(new StoredEvent(stream, ++sequence, event));
        }
        events.addAll(stored);
    }

    @Override
    public List<Event> load(String stream, String aggregateId) {
        return events.stream()
            .filter(e -> e.stream().equals(stream) && e.event().aggregateId().equals(aggregateId))
            .map(StoredEvent::event)
            .sorted(Comparator.comparingLong(Event::version))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<Event> loadVersion(String stream, String aggregateId, long version) {
        return load(stream, aggregateId).stream()
            .filter(e -> e.version() == version)
            .findFirst();
    }

    @Override
    public long currentVersion(String stream, String aggregateId) {
        return load(stream, aggregateId).stream()
            .mapToLong(Event::version)
            .max()
            .orElse(0);
    }

    @Override
    public List<String> aggregateIds(String stream) {
        return events.stream()
            .filter(e -> e.stream().equals(stream) && e.event().version() == 1)
            .map(e -> e.event().aggregateId())
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Event> query(String stream, Optional<String> type, Optional<String> aggregateId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return events.stream()
            .filter(e -> e.stream().equals(stream))
            .filter(e -> type.map(t -> t.equals(e.event().type())).orElse(true))
            .filter(e -> aggregateId.map(a -> a.equals(e.event().aggregateId())).orElse(true))
            .sorted(Comparator.comparingLong(StoredEvent::sequence).reversed())
            .limit(limit)
            .map(StoredEvent::event)
            .collect(Collectors.toCollection(ArrayList::new));
    }
}
