package com.geevly.student;

import com.geevly.eventsourcing.EventSourcedRepository;
import com.geevly.eventsourcing.EventStore;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.projection.PagedResult;
import com.geevly.projection.Paging;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Repository
public class StudentRepository extends EventSourcedRepository<StudentAggregate> {

    private static final String PROJECTION_TABLE = "student_projections";

    private static final RowMapper<ProjectedStudent> STUDENT_MAPPER = (rs, rowNum) -> new ProjectedStudent(
        rs.getString("id"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        localDate(rs.getDate("date_of_birth")),
        Sex.valueOf(rs.getString("sex")),
        StudentStatus.valueOf(rs.getString("status")),
        rs.getString("student_school_id"),
        rs.getInt("grade_level"),
        rs.getString("school_id"),
        localDate(rs.getDate("date_of_enrollment")),
        rs.getString("lookup_code"),
        rs.getString("profile_photo_id"),
        rs.getBoolean("eligible_for_sponsorship"),
        instant(rs.getObject("last_feeding_at", OffsetDateTime.class)),
        rs.getInt("feeding_count"),
        rs.getLong("version")
    );

    public StudentRepository(EventStore eventStore, NamedParameterJdbcTemplate jdbc, PayloadCodec codec, Clock clock) {
        super(eventStore, jdbc, codec, clock);
    }

    @Override
    public String stream() {
        return StudentAggregate.STREAM;
    }

    @Override
    public StudentAggregate newAggregate(String id) {
        return new StudentAggregate(id, codec, clock);
    }

    @Override
    @Transactional
    public void upsertProjection(StudentAggregate student) {
        if (student.isDeleted()) {
            removeProjection(student.getId());
            return;
        }
        if (!upsertStudent(student)) {
            return;
        }
        refreshLookupCode(student);
        refreshFeedings(student);
        refreshSponsorships(student);
        refreshHealthAssessments(student);
        refreshGradeReports(student);
    }

    /**
     * Writes the main student row. Child tables are keyed on it: callers refresh them only when
     * this returns {@code true}, otherwise a newer snapshot already owns them.
     */
    public boolean upsertStudent(StudentAggregate s) {
        FeedingRecord last = s.lastFeeding();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("first_name", s.getFirstName());
        row.put("last_name", s.getLastName());
        row.put("date_of_birth", s.getDateOfBirth());
        row.put("sex", s.getSex().name());
        row.put("status", s.getStatus().name());
        row.put("student_school_id", s.getStudentSchoolId());
        row.put("grade_level", s.getGradeLevel());
        row.put("school_id", s.getSchoolId());
        row.put("date_of_enrollment", s.getDateOfEnrollment());
        row.put("lookup_code", s.getLookupCode());
        row.put("profile_photo_id", s.getProfilePhotoId());
        row.put("eligible_for_sponsorship", s.isEligibleForSponsorship());
        row.put("last_feeding_at", last == null ? null : utc(last.timestamp()));
        row.put("feeding_count", s.getFeedings().size());
        row.put("version", s.getVersion());
        row.put("updated_at", utc(clock.instant()));
        return upsertVersioned(PROJECTION_TABLE, s.getId(), row);
    }

    public void refreshLookupCode(StudentAggregate s) {
        MapSqlParameterSource params = new MapSqlParameterSource("studentId", s.getId());
        jdbc.update("DELETE FROM student_code_lookup WHERE student_id = :studentId", params);
        if (s.getLookupCode() != null) {
            params.addValue("code", s.getLookupCode());
            jdbc.update("MERGE INTO student_code_lookup (code, student_id) KEY (code) VALUES (:code, :studentId)", params);
        }
    }

    public void refreshFeedings(StudentAggregate s) {
        List<FeedingRecord> feedings = s.getFeedings();
        SqlParameterSource[] rows = new SqlParameterSource[feedings.size()];
        for (int i = 0; i < feedings.size(); i++) {
            FeedingRecord f = feedings.get(i);
            rows[i] = new MapSqlParameterSource()
                .addValue("studentId", s.getId())
                .addValue("feedingId", i + 1)
                .addValue("schoolId", f.schoolId())
                .addValue("timestamp", utc(f.timestamp()))
                .addValue("fileId", f.fileId());
        }
        jdbc.batchUpdate(
            "MERGE INTO student_feeding_projections (student_id, feeding_id, school_id, feeding_timestamp, file_id) "
                + "KEY (student_id, feeding_id) VALUES (:studentId, :feedingId, :schoolId, :timestamp, :fileId)",
            rows);
    }

    public void refreshSponsorships(StudentAggregate s) {
        MapSqlParameterSource id = new MapSqlParameterSource("studentId", s.getId());
        jdbc.update("DELETE FROM student_sponsorship_projections WHERE student_id = :studentId", id);
        List<SponsorshipRecord> sponsorships = s.getSponsorships();
        SqlParameterSource[] rows = new SqlParameterSource[sponsorships.size()];
        for (int i = 0; i < sponsorships.size(); i++) {
            SponsorshipRecord r = sponsorships.get(i);
            rows[i] = new MapSqlParameterSource()
                .addValue("studentId", s.getId())
                .addValue("idx", i + 1)
                .addValue("sponsorId", r.sponsorId())
                .addValue("startDate", r.startDate())
                .addValue("endDate", r.endDate());
        }
        jdbc.batchUpdate(
            "INSERT INTO student_sponsorship_projections (student_id, idx, sponsor_id, start_date, end_date) "
                + "VALUES (:studentId, :idx, :sponsorId, :startDate, :endDate)",
            rows);
    }

    public void refreshHealthAssessments(StudentAggregate s) {
        MapSqlParameterSource id = new MapSqlParameterSource("studentId", s.getId());
        jdbc.update("DELETE FROM student_health_projections WHERE student_id = :studentId", id);
        List<HealthAssessment> assessments = s.getHealthAssessments();
        SqlParameterSource[] rows = new SqlParameterSource[assessments.size()];
        for (int i = 0; i < assessments.size(); i++) {
            HealthAssessment h = assessments.get(i);
            rows[i] = new MapSqlParameterSource()
                .addValue("studentId", s.getId())
                .addValue("idx", i + 1)
                .addValue("bulkUploadId", h.bulkUploadId())
                .addValue("assessmentDate", h.assessmentDate())
                .addValue("heightCm", h.heightCm())
                .addValue("weightKg", h.weightKg())
                .addValue("bmi", h.bmi())
                .addValue("status", h.nutritionalStatus(s.getSex(), s.getDateOfBirth())
                    .map(Enum::name)
                    .orElse(null));
        }
        jdbc.batchUpdate(
            "INSERT INTO student_health_projections "
                + "(student_id, idx, bulk_upload_id, assessment_date, height_cm, weight_kg, bmi, nutritional_status) "
                + "VALUES (:studentId, :idx, :bulkUploadId, :assessmentDate, :heightCm, :weightKg, :bmi, :status)",
            rows);
    }

    public void refreshGradeReports(StudentAggregate s) {
        MapSqlParameterSource id = new MapSqlParameterSource("studentId", s.getId());
        jdbc.update("DELETE FROM student_grade_projections WHERE student_id = :studentId", id);
        List<GradeReport> reports = s.getGradeReports();
        SqlParameterSource[] rows = new SqlParameterSource[reports.size()];
        for (int i = 0; i < reports.size(); i++) {
            GradeReport r = reports.get(i);
            rows[i] = new MapSqlParameterSource()
                .addValue("studentId", s.getId())
                .addValue("idx", i + 1)
                .addValue("bulkUploadId", r.bulkUploadId())
                .addValue("grade", r.grade())
                .addValue("testDate", r.testDate())
                .addValue("schoolYear", r.schoolYear())
                .addValue("gradingPeriod", r.gradingPeriod());
        }
        jdbc.batchUpdate(
            "INSERT INTO student_grade_projections "
                + "(student_id, idx, bulk_upload_id, grade, test_date, school_year, grading_period) "
                + "VALUES (:studentId, :idx, :bulkUploadId, :grade, :testDate, :schoolYear, :gradingPeriod)",
            rows);
    }

    public void removeProjection(String studentId) {
        MapSqlParameterSource id = new MapSqlParameterSource("studentId", studentId);
        jdbc.update("DELETE FROM student_code_lookup WHERE student_id = :studentId", id);
        jdbc.update("DELETE FROM student_feeding_projections WHERE student_id = :studentId", id);
        jdbc.update("DELETE FROM student_sponsorship_projections WHERE student_id = :studentId", id);
        jdbc.update("DELETE FROM student_health_projections WHERE student_id = :studentId", id);
        jdbc.update("DELETE FROM student_grade_projections WHERE student_id = :studentId", id);
        deleteRow(PROJECTION_TABLE, studentId);
    }

    // queries

    public Optional<ProjectedStudent> findProjected(String id) {
        return jdbc.query("SELECT * FROM student_projections WHERE id = :id",
                new MapSqlParameterSource("id", id), STUDENT_MAPPER)
            .stream()
            .findFirst();
    }

    public PagedResult<ProjectedStudent> list(StudentListFilter filter, Paging paging) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = where(filter, params);
        params.addValue("limit", paging.limit()).addValue("offset", paging.offset());
        List<ProjectedStudent> items = jdbc.query(
            "SELECT * FROM student_projections" + where
                + " ORDER BY last_name, first_name, id LIMIT :limit OFFSET :offset",
            params, STUDENT_MAPPER);
        return new PagedResult<>(items, count(filter));
    }

    public long count(StudentListFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM student_projections" + where(filter, params), params, Long.class);
        return count == null ? 0 : count;
    }

    public List<ProjectedStudent> listForSchool(String schoolId) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        return jdbc.query(
            "SELECT * FROM student_projections" + where(StudentListFilter.forSchool(schoolId), params)
                + " ORDER BY last_name, first_name, id",
            params, STUDENT_MAPPER);
    }

    public Optional<String> findIdByCode(String code) {
        return jdbc.queryForList("SELECT student_id FROM student_code_lookup WHERE code = :code",
                new MapSqlParameterSource("code", code), String.class)
            .stream()
            .findFirst();
    }

    public Optional<String> findIdBySchoolStudentId(String studentSchoolId, String schoolId) {
        return jdbc.queryForList(
                "SELECT id FROM student_projections WHERE student_school_id = :lrn AND school_id = :schoolId",
                new MapSqlParameterSource("lrn", studentSchoolId).addValue("schoolId", schoolId), String.class)
            .stream()
            .findFirst();
    }

    /**
     * Feedings at a school in {@code [from, to)}, grouped by student in name order.
     */
    public List<FeedingHistoryEntry> feedingHistory(String schoolId, Instant from, Instant to) {
        MapSqlParameterSource params = new MapSqlParameterSource("schoolId", schoolId)
            .addValue("from", utc(from))
            .addValue("to", utc(to));
        Map<String, FeedingHistoryEntry> byStudent = new LinkedHashMap<>();
        jdbc.query(
            "SELECT f.student_id, s.first_name, s.last_name, f.feeding_timestamp "
                + "FROM student_feeding_projections f JOIN student_projections s ON s.id = f.student_id "
                + "WHERE f.school_id = :schoolId AND f.feeding_timestamp >= :from AND f.feeding_timestamp < :to "
                + "ORDER BY s.last_name, s.first_name, f.student_id, f.feeding_timestamp",
            params,
            (RowCallbackHandler) rs -> {
                String studentId = rs.getString("student_id");
                FeedingHistoryEntry entry = byStudent.get(studentId);
                if (entry == null) {
                    entry = new FeedingHistoryEntry(studentId, rs.getString("first_name"), rs.getString("last_name"),
                        new ArrayList<>());
                    byStudent.put(studentId, entry);
                }
                entry.feedings().add(rs.getObject("feeding_timestamp", OffsetDateTime.class).toInstant());
            });
        return byStudent.values().stream()
            .map(e -> new FeedingHistoryEntry(e.studentId(), e.firstName(), e.lastName(), List.copyOf(e.feedings())))
            .toList();
    }

    public long countFeedings(String studentId, Instant from, Instant to) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM student_feeding_projections "
                + "WHERE student_id = :studentId AND feeding_timestamp >= :from AND feeding_timestamp < :to",
            new MapSqlParameterSource("studentId", studentId).addValue("from", utc(from)).addValue("to", utc(to)),
            Long.class);
        return count == null ? 0 : count;
    }

    public List<ProjectedStudent> sponsoredBy(String sponsorId, LocalDate on) {
        return jdbc.query(
            "SELECT s.* FROM student_projections s WHERE s.id IN ("
                + "SELECT p.student_id FROM student_sponsorship_projections p WHERE p.sponsor_id = :sponsorId "
                + "AND p.start_date <= :on AND (p.end_date IS NULL OR p.end_date >= :on)) "
                + "ORDER BY s.last_name, s.first_name, s.id",
            new MapSqlParameterSource("sponsorId", sponsorId).addValue("on", on),
            STUDENT_MAPPER);
    }

    private static String where(StudentListFilter filter, MapSqlParameterSource params) {
        List<String> clauses = new ArrayList<>();
        if (filter.activeOnly()) {
            clauses.add("status = 'ACTIVE'");
        }
        if (filter.eligibleForSponsorshipOnly()) {
            clauses.add("eligible_for_sponsorship = TRUE");
        }
        if (!filter.schoolIds().isEmpty()) {
            clauses.add("school_id IN (:schoolIds)");
            params.addValue("schoolIds", filter.schoolIds());
        }
        if (filter.minDateOfBirth() != null) {
            clauses.add("date_of_birth >= :minDob");
            params.addValue("minDob", filter.minDateOfBirth());
        }
        if (filter.maxDateOfBirth() != null) {
            clauses.add("date_of_birth <= :maxDob");
            params.addValue("maxDob", filter.maxDateOfBirth());
        }
        if (filter.nameSearch() != null && !filter.nameSearch().isBlank()) {
            clauses.add("(LOWER(first_name) LIKE :name OR LOWER(last_name) LIKE :name OR student_school_id LIKE :name)");
            params.addValue("name", "%" + filter.nameSearch().trim().toLowerCase(Locale.ROOT) + "%");
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    private static LocalDate localDate(Date date) {
        return date == null ? null : date.toLocalDate();
    }

    private static Instant instant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
