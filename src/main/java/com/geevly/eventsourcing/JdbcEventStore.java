package com.geevly.eventsourcing;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Event store on the {@code domain_events} table. The primary key
 * {@code (stream, aggregate_id, version)} is what finally arbitrates concurrent writers.
 */
@Repository
public class JdbcEventStore implements EventStore {

    private static final String COLUMNS = "event_type, aggregate_id, version, occurred_at, payload";

    private static final RowMapper<Event> EVENT_MAPPER = (rs, rowNum) -> new Event(
        rs.getString("event_type"),
        rs.getString("aggregate_id"),
        rs.getLong("version"),
        rs.getObject("occurred_at", OffsetDateTime.class).toInstant(),
        rs.getBytes("payload")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcEventStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void append(String stream, String aggregateId, List<Event> events) {
        if (events.isEmpty()) {
            return;
        }
        long current = currentVersion(stream, aggregateId);
        long expected = current + 1;
        for (Event event : events) {
            if (!aggregateId.equals(event.aggregateId())) {
                throw new IllegalArgumentException("event for " + event.aggregateId() + " appended to " + aggregateId);
            }
            if (event.version() != expected) {
                throw new VersionConflictException(aggregateId, event.version() - 1, expected - 1);
            }
            expected++;
        }

        List<Object[]> rows = new ArrayList<>(events.size());
        for (Event event : events) {
            rows.add(new Object[] {
                stream,
                event.aggregateId(),
                event.version(),
                event.type(),
                OffsetDateTime.ofInstant(event.timestamp(), ZoneOffset.UTC),
                event.payload()
            });
        }
        try {
            jdbcTemplate.batchUpdate(
                "INSERT INTO domain_events (stream, aggregate_id, version, event_type, occurred_at, payload) "
                    + "VALUES (?, ?, ?, ?, ?, ?)",
                rows);
        } catch (DuplicateKeyException ex) {
            throw new VersionConflictException(aggregateId, events.get(0).version(), ex);
        }
    }

    @Override
    public List<Event> load(String stream, String aggregateId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM domain_events WHERE stream = ? AND aggregate_id = ? ORDER BY version",
            EVENT_MAPPER, stream, aggregateId);
    }

    @Override
    public Optional<Event> loadVersion(String stream, String aggregateId, long version) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM domain_events WHERE stream = ? AND aggregate_id = ? AND version = ?",
                EVENT_MAPPER, stream, aggregateId, version)
            .stream()
            .findFirst();
    }

    @Override
    public long currentVersion(String stream, String aggregateId) {
        Long version = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(version), 0) FROM domain_events WHERE stream = ? AND aggregate_id = ?",
            Long.class, stream, aggregateId);
        return version == null ? 0 : version;
    }

    @Override
    public List<String> aggregateIds(String stream) {
        return jdbcTemplate.queryForList(
            "SELECT aggregate_id FROM domain_events WHERE stream = ? AND version = 1 ORDER BY sequence_number",
            String.class, stream);
    }

    @Override
    public List<Event> query(String stream, Optional<String> type, Optional<String> aggregateId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM domain_events WHERE stream = ?");
        List<Object> args = new ArrayList<>();
        args.add(stream);
        type.ifPresent(t -> {
            sql.append(" AND event_type = ?");
            args.add(t);
        });
        aggregateId.ifPresent(a -> {
            sql.append(" AND aggregate_id = ?");
            args.add(a);
        });
        sql.append(" ORDER BY sequence_number DESC LIMIT ?");
        args.add(limit);
        return jdbcTemplate.query(sql.toString(), EVENT_MAPPER, args.toArray());
    }
}
