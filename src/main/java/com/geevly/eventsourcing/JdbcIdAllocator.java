package com.geevly.eventsourcing;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sequential ids per domain type from {@code aggregate_id_tracking}. The row update holds the
 * row lock until commit, so two callers never read the same value.
 */
@Repository
public class JdbcIdAllocator implements IdAllocator {

    private static final String INCREMENT =
        "UPDATE aggregate_id_tracking SET next_id = next_id + 1 WHERE type = ?";

    private final JdbcTemplate jdbcTemplate;

    public JdbcIdAllocator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public long nextId(String type) {
        if (jdbcTemplate.update(INCREMENT, type) == 0) {
            try {
                jdbcTemplate.update("INSERT INTO aggregate_id_tracking (type, next_id) VALUES (?, 1)", type);
            } catch (DuplicateKeyException ex) {
                // first id for this type was taken concurrently
                jdbcTemplate.update(INCREMENT, type);
            }
        }
        Long next = jdbcTemplate.queryForObject(
            "SELECT next_id FROM aggregate_id_tracking WHERE type = ?", Long.class, type);
        if (next == null) {
            throw new IllegalStateException("no id tracking row for " + type);
        }
        return next;
    }
}
