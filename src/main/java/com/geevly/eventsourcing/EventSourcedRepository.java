package com.geevly.eventsourcing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads aggregates by replaying their stream, saves the events they raise and writes their
 * projection rows.
 */
public abstract class EventSourcedRepository<A extends AggregateRoot<A>> {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);

    protected final EventStore eventStore;
    protected final NamedParameterJdbcTemplate jdbc;
    protected final PayloadCodec codec;
    protected final Clock clock;

    protected EventSourcedRepository(EventStore eventStore, NamedParameterJdbcTemplate jdbc, PayloadCodec codec,
                                     Clock clock) {
        this.eventStore = eventStore;
        this.jdbc = jdbc;
        this.codec = codec;
        this.clock = clock;
    }

    public abstract String stream();

    public abstract A newAggregate(String id);

    /**
     * Overwrites every projection row derived from the aggregate with its current state.
     */
    public abstract void upsertProjection(A aggregate);

    public A load(String id) {
        List<Event> history = eventStore.load(stream(), id);
        if (history.isEmpty()) {
            throw new AggregateNotFoundException(stream(), id);
        }
        A aggregate = newAggregate(id);
        aggregate.load(history);
        return aggregate;
    }

    public void save(String aggregateId, List<Event> events) {
        eventStore.append(stream(), aggregateId, events);
    }

    public List<Event> history(String id) {
        List<Event> history = eventStore.load(stream(), id);
        if (history.isEmpty()) {
            throw new AggregateNotFoundException(stream(), id);
        }
        return history;
    }

    public Event event(String id, long version) {
        return eventStore.loadVersion(stream(), id, version)
            .orElseThrow(() -> new NotFoundException(stream() + " " + id + " has no event at version " + version));
    }

    public List<String> aggregateIds() {
        return eventStore.aggregateIds(stream());
    }

    public int rebuildProjections() {
        List<String> ids = aggregateIds();
        for (String id : ids) {
            upsertProjection(load(id));
        }
        log.info("Rebuilt {} projections for {} aggregates", stream(), ids.size());
        return ids.size();
    }

    /**
     * Writes one projection row keyed by {@code id}. The row is only overwritten when the incoming
     * {@code version} column is at least the stored one, so a late refresh cannot roll it back.
     *
     * @return {@code false} when a newer version is already stored and nothing was written
     */
    protected boolean upsertVersioned(String table, Object id, Map<String, Object> columns) {
        if (!columns.containsKey("version")) {
            throw new IllegalArgumentException("projection row for " + table + " has no version column");
        }
        MapSqlParameterSource params = new MapSqlParameterSource(columns).addValue("id", id);
        String assignments = columns.keySet().stream()
            .map(c -> c + " = :" + c)
            .collect(Collectors.joining(", "));
        String update = "UPDATE " + table + " SET " + assignments + " WHERE id = :id AND version <= :version";
        if (jdbc.update(update, params) > 0) {
            return true;
        }
        String names = String.join(", ", columns.keySet());
        String values = columns.keySet().stream().map(c -> ":" + c).collect(Collectors.joining(", "));
        try {
            jdbc.update("INSERT INTO " + table + " (id, " + names + ") VALUES (:id, " + values + ")", params);
            return true;
        } catch (DuplicateKeyException ex) {
            // row exists; only move it forward
            boolean written = jdbc.update(update, params) > 0;
            if (!written) {
                log.debug("Skipped stale {} row id={} version={}", table, id, columns.get("version"));
            }
            return written;
        }
    }

    protected void deleteRow(String table, Object id) {
        jdbc.update("DELETE FROM " + table + " WHERE id = :id", new MapSqlParameterSource("id", id));
    }

    protected static OffsetDateTime utc(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
