package com.geevly.bulkupload;

import com.fasterxml.jackson.core.type.TypeReference;
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
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class BulkUploadRepository extends EventSourcedRepository<BulkUploadAggregate> {

    private static final TypeReference<Map<String, String>> METADATA = new TypeReference<>() {};
    private static final TypeReference<List<ValidationError>> ERRORS = new TypeReference<>() {};

    private final RowMapper<ProjectedBulkUpload> uploadMapper = (rs, rowNum) -> new ProjectedBulkUpload(
        rs.getString("id"),
        BulkUploadStatus.fromValue(rs.getString("status")),
        TargetDomain.fromValue(rs.getString("target_domain")),
        rs.getString("file_id"),
        instant(rs.getObject("initiated_at", OffsetDateTime.class)),
        instant(rs.getObject("completed_at", OffsetDateTime.class)),
        instant(rs.getObject("invalidation_started_at", OffsetDateTime.class)),
        instant(rs.getObject("invalidation_completed_at", OffsetDateTime.class)),
        rs.getInt("total_records"),
        rs.getInt("processed_records"),
        rs.getInt("invalidated_records"),
        codec.fromJson(rs.getString("upload_metadata"), METADATA),
        codec.fromJson(rs.getString("validation_errors"), ERRORS),
        rs.getLong("version")
    );

    public BulkUploadRepository(EventStore eventStore, NamedParameterJdbcTemplate jdbc, PayloadCodec codec, Clock clock) {
        super(eventStore, jdbc, codec, clock);
    }

    @Override
    public String stream() {
        return BulkUploadAggregate.STREAM;
    }

    @Override
    public BulkUploadAggregate newAggregate(String id) {
        return new BulkUploadAggregate(id, codec, clock);
    }

    @Override
    public void upsertProjection(BulkUploadAggregate upload) {
        List<TrackedRecord> records = upload.getRecords();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("status", upload.getStatus().getValue());
        row.put("target_domain", upload.getTargetDomain().getValue());
        row.put("file_id", upload.getFileId());
        row.put("initiated_at", utc(upload.getInitiatedAt()));
        row.put("completed_at", utc(upload.lastEntered(BulkUploadStatus.COMPLETED).orElse(null)));
        row.put("invalidation_started_at", utc(upload.firstEntered(BulkUploadStatus.INVALIDATING).orElse(null)));
        row.put("invalidation_completed_at", utc(upload.lastEntered(BulkUploadStatus.INVALIDATED).orElse(null)));
        row.put("total_records", records.size());
        row.put("processed_records", (int) records.stream().filter(TrackedRecord::wasProcessed).count());
        row.put("invalidated_records",
            (int) records.stream().filter(r -> r.lastReason() == RecordActionReason.INVALIDATED).count());
        row.put("upload_metadata", codec.toJson(upload.getUploadMetadata()));
        row.put("validation_errors", codec.toJson(upload.getValidationErrors()));
        row.put("version", upload.getVersion());
        row.put("updated_at", utc(clock.instant()));
        upsertVersioned("bulk_uploads", upload.getId(), row);
    }

    public Optional<ProjectedBulkUpload> findProjected(String id) {
        return jdbc.query("SELECT * FROM bulk_uploads WHERE id = :id", new MapSqlParameterSource("id", id), uploadMapper)
            .stream()
            .findFirst();
    }

    public PagedResult<ProjectedBulkUpload> list(Optional<TargetDomain> targetDomain, Paging paging) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", paging.limit())
            .addValue("offset", paging.offset());
        String where = "";
        if (targetDomain.isPresent()) {
            where = " WHERE target_domain = :target_domain";
            params.addValue("target_domain", targetDomain.get().getValue());
        }
        List<ProjectedBulkUpload> items = jdbc.query(
            "SELECT * FROM bulk_uploads" + where + " ORDER BY initiated_at DESC, id LIMIT :limit OFFSET :offset",
            params, uploadMapper);
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM bulk_uploads" + where, params, Long.class);
        return new PagedResult<>(items, count == null ? 0 : count);
    }

    private static Instant instant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
