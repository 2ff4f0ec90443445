package com.geevly.bulkupload;

import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.PayloadCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BulkUploadAggregateTest {

    private static final Instant NOW = Instant.parse("2024-06-03T09:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 3);

    private static final BulkUploadAntiCorruptionLayer FILES = new BulkUploadAntiCorruptionLayer() {
        @Override
        public void validateFileId(String fileId) {
            if (!fileId.startsWith("file-")) {
                throw new CommandValidationException("unknown file " + fileId);
            }
        }

        @Override
        public byte[] fileContent(String fileId) {
            return new byte[0];
        }
    };

    private BulkUploadAggregate upload(TargetDomain domain, Map<String, String> metadata) {
        BulkUploadAggregate upload = new BulkUploadAggregate("u-1", PayloadCodec.defaultCodec());
        upload.create(new CreateBulkUpload(domain, "file-1", metadata), NOW, TODAY, FILES);
        return upload;
    }

    private BulkUploadAggregate processing() {
        BulkUploadAggregate upload = upload(TargetDomain.HEALTH_ASSESSMENT, Map.of("school_id", "4"));
        upload.setStatus(BulkUploadStatus.VALIDATING, NOW);
        upload.setStatus(BulkUploadStatus.VALIDATED, NOW);
        upload.setStatus(BulkUploadStatus.PROCESSING, NOW);
        return upload;
    }

    private static Map<String, String> gradesMetadata() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("school_id", "4");
        metadata.put("school_year", "2023-2024");
        metadata.put("grading_period", "3");
        metadata.put("effective_date", "2024-05-30");
        return metadata;
    }

    @Nested
    @DisplayName("creation")
    class Creation {

        @Test
        @DisplayName("new upload is pending with blank metadata dropped")
        void pending() {
            Map<String, String> metadata = new HashMap<>();
            metadata.put("school_id", " 4 ");
            metadata.put("note", "  ");
            BulkUploadAggregate upload = upload(TargetDomain.NEW_STUDENTS, metadata);

            assertEquals(BulkUploadStatus.PENDING, upload.getStatus());
            assertEquals(Map.of("school_id", "4"), upload.getUploadMetadata());
            assertEquals(NOW, upload.getInitiatedAt());
        }

        @Test
        @DisplayName("school id is required for every target domain")
        void schoolIdRequired() {
            assertThrows(CommandValidationException.class, () -> upload(TargetDomain.HEALTH_ASSESSMENT, Map.of()));
        }

        @Test
        @DisplayName("unknown file is rejected")
        void unknownFile() {
            BulkUploadAggregate upload = new BulkUploadAggregate("u-2", PayloadCodec.defaultCodec());
            assertThrows(CommandValidationException.class, () -> upload.create(
                new CreateBulkUpload(TargetDomain.NEW_STUDENTS, "elsewhere", Map.of("school_id", "4")), NOW, TODAY, FILES));
            assertFalse(upload.exists());
        }

        @Test
        @DisplayName("grade uploads need a complete, well-formed grading context")
        void gradesMetadata() {
            assertEquals("2023-2024", upload(TargetDomain.GRADES, BulkUploadAggregateTest.gradesMetadata()).metadata("school_year").orElseThrow());

            Map<String, String> badYear = BulkUploadAggregateTest.gradesMetadata();
            badYear.put("school_year", "2023/24");
            assertThrows(CommandValidationException.class, () -> upload(TargetDomain.GRADES, badYear));

            Map<String, String> future = BulkUploadAggregateTest.gradesMetadata();
            future.put("effective_date", "2024-06-04");
            assertThrows(CommandValidationException.class, () -> upload(TargetDomain.GRADES, future));

            Map<String, String> badPeriod = BulkUploadAggregateTest.gradesMetadata();
            badPeriod.put("grading_period", "Q3");
            assertThrows(CommandValidationException.class, () -> upload(TargetDomain.GRADES, badPeriod));

            Map<String, String> noDate = BulkUploadAggregateTest.gradesMetadata();
            noDate.remove("effective_date");
            assertThrows(CommandValidationException.class, () -> upload(TargetDomain.GRADES, noDate));

            Map<String, String> textSchool = BulkUploadAggregateTest.gradesMetadata();
            textSchool.put("school_id", "north");
            assertThrows(CommandValidationException.class, () -> upload(TargetDomain.GRADES, textSchool));
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("illegal transitions are rejected")
        void illegalTransition() {
            BulkUploadAggregate upload = upload(TargetDomain.NEW_STUDENTS, Map.of("school_id", "4"));
            assertThrows(CommandValidationException.class, () -> upload.setStatus(BulkUploadStatus.PROCESSING, NOW));
            assertThrows(CommandValidationException.class, () -> upload.setStatus(BulkUploadStatus.COMPLETED, NOW));
            assertEquals(BulkUploadStatus.PENDING, upload.getStatus());
        }

        @Test
        @DisplayName("validation errors move the upload to validation failed")
        void validationErrors() {
            BulkUploadAggregate upload = upload(TargetDomain.NEW_STUDENTS, Map.of("school_id", "4"));
            upload.setStatus(BulkUploadStatus.VALIDATING, NOW);
            assertThrows(CommandValidationException.class, () -> upload.addValidationErrors(List.of(), NOW));

            upload.addValidationErrors(List.of(new ValidationError(2, "lrn", "lrn is required")), NOW);
            assertEquals(BulkUploadStatus.VALIDATION_FAILED, upload.getStatus());
            assertEquals(1, upload.getValidationErrors().size());
            assertTrue(BulkUploadStatus.VALIDATION_FAILED.successors().isEmpty());
        }

        @Test
        @DisplayName("status history keeps every entry time")
        void statusHistory() {
            BulkUploadAggregate upload = processing();
            Instant later = NOW.plusSeconds(60);
            upload.setStatus(BulkUploadStatus.COMPLETED, later);

            assertEquals(5, upload.getStatusHistory().size());
            assertEquals(later, upload.lastEntered(BulkUploadStatus.COMPLETED).orElseThrow());
            assertTrue(upload.firstEntered(BulkUploadStatus.INVALIDATING).isEmpty());
        }

        @Test
        @DisplayName("failed undo can be retried")
        void retryAfterInvalidationFailure() {
            BulkUploadAggregate upload = processing();
            upload.setStatus(BulkUploadStatus.ERROR, NOW);
            upload.setStatus(BulkUploadStatus.INVALIDATING, NOW);
            upload.setStatus(BulkUploadStatus.INVALIDATION_FAILED, NOW);
            upload.setStatus(BulkUploadStatus.INVALIDATING, NOW);
            upload.setStatus(BulkUploadStatus.INVALIDATED, NOW);
            assertThrows(CommandValidationException.class, () -> upload.setStatus(BulkUploadStatus.INVALIDATING, NOW));
        }
    }

    @Nested
    @DisplayName("record tracking")
    class RecordTracking {

        @Test
        @DisplayName("records move from pending to processing to invalidated")
        void lifecycle() {
            BulkUploadAggregate upload = processing();
            upload.addRecordsToProcess(List.of("s1", "s2", "s2"), RecordType.STUDENT, NOW);
            upload.markRecordsProcessed(List.of("s1"), RecordType.STUDENT, NOW);

            assertEquals(RecordActionReason.PENDING, upload.lastReason("s2").orElseThrow());
            assertEquals(List.of("s1"), upload.recordsToUndo().stream().map(TrackedRecord::recordId).toList());

            upload.setStatus(BulkUploadStatus.COMPLETED, NOW);
            upload.setStatus(BulkUploadStatus.INVALIDATING, NOW);
            upload.markRecordsInvalidated(List.of("s1"), RecordType.STUDENT, NOW);

            assertEquals(RecordActionReason.INVALIDATED, upload.lastReason("s1").orElseThrow());
            assertTrue(upload.recordsToUndo().isEmpty());
            assertEquals(3, upload.getRecords().get(0).actions().size());
        }

        @Test
        @DisplayName("tracking is only allowed in the matching status")
        void statusGuards() {
            BulkUploadAggregate upload = upload(TargetDomain.NEW_STUDENTS, Map.of("school_id", "4"));
            assertThrows(CommandValidationException.class,
                () -> upload.addRecordsToProcess(List.of("s1"), RecordType.STUDENT, NOW));

            BulkUploadAggregate running = processing();
            running.addRecordsToProcess(List.of("s1"), RecordType.STUDENT, NOW);
            assertThrows(CommandValidationException.class,
                () -> running.markRecordsInvalidated(List.of("s1"), RecordType.STUDENT, NOW));
        }

        @Test
        @DisplayName("records are queued once and must be queued before processing")
        void queueRules() {
            BulkUploadAggregate upload = processing();
            upload.addRecordsToProcess(List.of("s1"), RecordType.STUDENT, NOW);
            assertThrows(CommandValidationException.class,
                () -> upload.addRecordsToProcess(List.of("s1"), RecordType.STUDENT, NOW));
            assertThrows(CommandValidationException.class,
                () -> upload.markRecordsProcessed(List.of("s9"), RecordType.STUDENT, NOW));
            assertThrows(CommandValidationException.class,
                () -> upload.addRecordsToProcess(List.of(), RecordType.STUDENT, NOW));
        }

        @Test
        @DisplayName("only processed records can be invalidated")
        void invalidateRequiresProcessed() {
            BulkUploadAggregate upload = processing();
            upload.addRecordsToProcess(List.of("s1", "s2"), RecordType.STUDENT, NOW);
            upload.markRecordsProcessed(List.of("s1"), RecordType.STUDENT, NOW);
            upload.setStatus(BulkUploadStatus.ERROR, NOW);
            upload.setStatus(BulkUploadStatus.INVALIDATING, NOW);

            assertThrows(CommandValidationException.class,
                () -> upload.markRecordsInvalidated(List.of("s2"), RecordType.STUDENT, NOW));
            upload.markRecordsInvalidated(List.of("s1"), RecordType.STUDENT, NOW);
            assertThrows(CommandValidationException.class,
                () -> upload.markRecordsInvalidated(List.of("s1"), RecordType.STUDENT, NOW));
        }
    }
}
