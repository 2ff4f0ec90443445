package com.geevly.file;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class FileRepository extends EventSourcedRepository<FileAggregate> {

    private static final RowMapper<ProjectedFile> FILE_MAPPER = (rs, rowNum) -> new ProjectedFile(
        rs.getString("id"),
        rs.getString("domain_reference"),
        rs.getString("name"),
        rs.getString("mime_type"),
        rs.getLong("size"),
        rs.getBoolean("deleted"),
        rs.getLong("version")
    );

    public FileRepository(EventStore eventStore, NamedParameterJdbcTemplate jdbc, PayloadCodec codec, Clock clock) {
        super(eventStore, jdbc, codec, clock);
    }

    @Override
    public String stream() {
        return FileAggregate.STREAM;
    }

    @Override
    public FileAggregate newAggregate(String id) {
        return new FileAggregate(id, codec, clock);
    }

    @Override
    public void upsertProjection(FileAggregate file) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("domain_reference", file.getDomainReference());
        row.put("name", file.getName());
        row.put("mime_type", file.getMimeType());
        row.put("size", file.getSize());
        row.put("deleted", file.isDeleted());
        row.put("version", file.getVersion());
        upsertVersioned("files", file.getId(), row);
    }

    public Optional<ProjectedFile> findProjected(String id) {
        return jdbc.query("SELECT * FROM files WHERE id = :id", new MapSqlParameterSource("id", id), FILE_MAPPER)
            .stream()
            .findFirst();
    }

    public PagedResult<ProjectedFile> listByDomain(String domainReference, Paging paging) {
        MapSqlParameterSource params = new MapSqlParameterSource("domain", domainReference)
            .addValue("limit", paging.limit())
            .addValue("offset", paging.offset());
        List<ProjectedFile> items = jdbc.query(
            "SELECT * FROM files WHERE domain_reference = :domain AND deleted = FALSE "
                + "ORDER BY name, id LIMIT :limit OFFSET :offset",
            params, FILE_MAPPER);
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM files WHERE domain_reference = :domain AND deleted = FALSE", params, Long.class);
        return new PagedResult<>(items, count == null ? 0 : count);
    }
}
