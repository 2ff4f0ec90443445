package com.geevly.school;

import com.geevly.eventsourcing.EventSourcedRepository;
import com.geevly.eventsourcing.EventStore;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.projection.PagedResult;
import com.geevly.projection.Paging;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class SchoolRepository extends EventSourcedRepository<SchoolAggregate> {

    private static final RowMapper<ProjectedSchool> SCHOOL_MAPPER = (rs, rowNum) -> new ProjectedSchool(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("principal"),
        rs.getString("contact_number"),
        rs.getBoolean("active"),
        rs.getLong("version"),
        rs.getObject("updated_at", OffsetDateTime.class).toInstant()
    );

    public SchoolRepository(EventStore eventStore, NamedParameterJdbcTemplate jdbc, PayloadCodec codec, Clock clock) {
        super(eventStore, jdbc, codec, clock);
    }

    @Override
    public String stream() {
        return SchoolAggregate.STREAM;
    }

    @Override
    public SchoolAggregate newAggregate(String id) {
        return new SchoolAggregate(id, codec, clock);
    }

    @Override
    public void upsertProjection(SchoolAggregate school) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", school.getName());
        row.put("principal", school.getPrincipal());
        row.put("contact_number", school.getContactNumber());
        row.put("active", school.isActive());
        row.put("version", school.getVersion());
        row.put("updated_at", utc(clock.instant()));
        upsertVersioned("schools", school.getId(), row);
    }

    public Optional<ProjectedSchool> findProjected(String id) {
        return jdbc.query("SELECT * FROM schools WHERE id = :id", new MapSqlParameterSource("id", id), SCHOOL_MAPPER)
            .stream()
            .findFirst();
    }

    public PagedResult<ProjectedSchool> list(Paging paging) {
        List<ProjectedSchool> items = jdbc.query(
            "SELECT * FROM schools ORDER BY name, id LIMIT :limit OFFSET :offset",
            new MapSqlParameterSource("limit", paging.limit()).addValue("offset", paging.offset()),
            SCHOOL_MAPPER);
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM schools", Long.class);
        return new PagedResult<>(items, count == null ? 0 : count);
    }

    public List<ProjectedSchool> findAll(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbc.query("SELECT * FROM schools WHERE id IN (:ids)", new MapSqlParameterSource("ids", ids),
            SCHOOL_MAPPER);
    }
}
