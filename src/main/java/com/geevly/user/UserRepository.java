package com.geevly.user;

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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class UserRepository extends EventSourcedRepository<UserAggregate> {

    private static final RowMapper<ProjectedUser> USER_MAPPER = (rs, rowNum) -> {
        String roles = rs.getString("roles");
        OffsetDateTime passwordChangedAt = rs.getObject("password_changed_at", OffsetDateTime.class);
        return new ProjectedUser(
            rs.getString("id"),
            rs.getString("first_name"),
            rs.getString("last_name"),
            rs.getString("email"),
            rs.getBoolean("active"),
            roles == null || roles.isEmpty() ? List.of() : Arrays.asList(roles.split(",")),
            passwordChangedAt == null ? null : passwordChangedAt.toInstant(),
            rs.getLong("version"));
    };

    public UserRepository(EventStore eventStore, NamedParameterJdbcTemplate jdbc, PayloadCodec codec, Clock clock) {
        super(eventStore, jdbc, codec, clock);
    }

    @Override
    public String stream() {
        return UserAggregate.STREAM;
    }

    @Override
    public UserAggregate newAggregate(String id) {
        return new UserAggregate(id, codec, clock);
    }

    @Override
    public void upsertProjection(UserAggregate user) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("first_name", user.getFirstName());
        row.put("last_name", user.getLastName());
        row.put("email", user.getEmail());
        row.put("active", user.isActive());
        row.put("roles", user.getRoles().stream().map(UserRole::role).collect(Collectors.joining(",")));
        row.put("password_changed_at", utc(user.getPasswordChangedAt()));
        row.put("version", user.getVersion());
        upsertVersioned("users", user.getId(), row);
    }

    public Optional<ProjectedUser> findProjected(String id) {
        return jdbc.query("SELECT * FROM users WHERE id = :id", new MapSqlParameterSource("id", id), USER_MAPPER)
            .stream()
            .findFirst();
    }

    public Optional<String> findIdByEmail(String email) {
        return jdbc.queryForList("SELECT id FROM users WHERE email = :email",
                new MapSqlParameterSource("email", email), String.class)
            .stream()
            .findFirst();
    }

    public PagedResult<ProjectedUser> list(Paging paging) {
        List<ProjectedUser> items = jdbc.query(
            "SELECT * FROM users ORDER BY last_name, first_name, id LIMIT :limit OFFSET :offset",
            new MapSqlParameterSource("limit", paging.limit()).addValue("offset", paging.offset()),
            USER_MAPPER);
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM users", Long.class);
        return new PagedResult<>(items, count == null ? 0 : count);
    }
}
