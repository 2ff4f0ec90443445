package com.geevly.bulkupload;

import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.file.FileCommands.CreateFile;
import com.geevly.file.FileService;
import com.geevly.school.SchoolCommands.CreateSchool;
import com.geevly.school.SchoolService;
import com.geevly.student.GradeReport;
import com.geevly.student.Sex;
import com.geevly.student.StudentAggregate;
import com.geevly.student.StudentCommands.CreateStudent;
import com.geevly.student.StudentCommands.Enroll;
import com.geevly.student.StudentCommands.Unenroll;
import com.geevly.student.StudentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class BulkUploadWorkflowIntegrationTest {

    @Autowired BulkUploadWorkflow workflow;
    @Autowired BulkUploadService uploads;
    @Autowired FileService files;
    @Autowired SchoolService schools;
    @Autowired StudentService students;

    private String schoolId;
    private String lrnA;
    private String lrnB;
    private StudentAggregate studentA;
    private StudentAggregate studentB;

    @BeforeEach
    void enrolStudents() {
        schoolId = schools.createSchool(new CreateSchool("Upload School " + UUID.randomUUID(), null, null)).getId();
        lrnA = "LRN-" + UUID.randomUUID();
        lrnB = "LRN-" + UUID.randomUUID();
        studentA = enrolled("Ana", lrnA);
        studentB = enrolled("Ben", lrnB);
    }

    private StudentAggregate enrolled(String firstName, String lrn) {
        StudentAggregate student = students.createStudent(
            new CreateStudent(firstName, "Upload", LocalDate.of(2013, 2, 1), Sex.FEMALE, 5, lrn));
        return students.enroll(student.getId(), new Enroll(student.getVersion(), schoolId, LocalDate.now()));
    }

    private BulkUploadAggregate upload(TargetDomain domain, String csv, Map<String, String> metadata) {
        String fileId = files.createFile(new CreateFile(domain.getValue() + ".csv", "bulk_upload", "text/csv"),
            csv.getBytes(StandardCharsets.UTF_8)).getId();
        return uploads.create(new CreateBulkUpload(domain, fileId, metadata));
    }

    private BulkUploadAggregate healthUpload() {
        String yesterday = LocalDate.now().minusDays(1).toString();
        return upload(TargetDomain.HEALTH_ASSESSMENT,
            "lrn,height_cm,weight_kg,assessment_date\n"
                + lrnA + ",140,30," + yesterday + "\n"
                + lrnB + ",138.5,29.2," + yesterday + "\n",
            Map.of(BulkUploadAggregate.SCHOOL_ID, schoolId));
    }

    @Nested
    @DisplayName("health assessments")
    class HealthAssessments {

        @Test
        @DisplayName("validate, process and undo round trip")
        void processAndUndo() {
            BulkUploadAggregate upload = healthUpload();
            assertEquals(BulkUploadStatus.VALIDATED, workflow.validate(upload.getId()).getStatus());

            BulkUploadAggregate done = workflow.process(upload.getId());
            assertEquals(BulkUploadStatus.COMPLETED, done.getStatus());
            assertEquals(1, students.get(studentA.getId()).getHealthAssessments().size());
            ProjectedBulkUpload projected = uploads.getProjected(upload.getId());
            assertEquals(2, projected.totalRecords());
            assertEquals(2, projected.processedRecords());
            assertNotNull(projected.completedAt());

            BulkUploadAggregate undone = workflow.undo(upload.getId());
            assertEquals(BulkUploadStatus.INVALIDATED, undone.getStatus());
            assertTrue(students.get(studentA.getId()).getHealthAssessments().isEmpty());
            assertTrue(students.get(studentB.getId()).getHealthAssessments().isEmpty());
            assertEquals(2, uploads.getProjected(upload.getId()).invalidatedRecords());
        }

        @Test
        @DisplayName("undoing twice changes nothing the second time")
        void undoIsIdempotent() {
            BulkUploadAggregate upload = healthUpload();
            workflow.validate(upload.getId());
            workflow.process(upload.getId());
            long version = workflow.undo(upload.getId()).getVersion();

            BulkUploadAggregate again = workflow.undo(upload.getId());
            assertEquals(BulkUploadStatus.INVALIDATED, again.getStatus());
            assertEquals(version, again.getVersion());
        }

        @Test
        @DisplayName("undo tolerates records already removed downstream")
        void undoToleratesMissingRecord() {
            BulkUploadAggregate upload = healthUpload();
            workflow.validate(upload.getId());
            workflow.process(upload.getId());
            students.removeHealthAssessment(studentA.getId(), upload.getId());

            BulkUploadAggregate undone = workflow.undo(upload.getId());
            assertEquals(BulkUploadStatus.INVALIDATED, undone.getStatus());
            assertTrue(undone.recordsToUndo().isEmpty());
            assertTrue(students.get(studentB.getId()).getHealthAssessments().isEmpty());
        }

        @Test
        @DisplayName("unknown learner fails validation with a row error")
        void unknownLearner() {
            BulkUploadAggregate upload = upload(TargetDomain.HEALTH_ASSESSMENT,
                "lrn,height_cm,weight_kg,assessment_date\nLRN-nobody-" + UUID.randomUUID() + ",140,30,2024-01-05\n",
                Map.of(BulkUploadAggregate.SCHOOL_ID, schoolId));

            BulkUploadAggregate failed = workflow.validate(upload.getId());
            assertEquals(BulkUploadStatus.VALIDATION_FAILED, failed.getStatus());
            assertEquals(1, failed.getValidationErrors().get(0).row());
            assertEquals("lrn", failed.getValidationErrors().get(0).field());
            assertFalse(uploads.getProjected(upload.getId()).validationErrors().isEmpty());
        }

        @Test
        @DisplayName("missing columns fail validation")
        void missingColumns() {
            BulkUploadAggregate upload = upload(TargetDomain.HEALTH_ASSESSMENT, "lrn,height_cm\n" + lrnA + ",140\n",
                Map.of(BulkUploadAggregate.SCHOOL_ID, schoolId));

            BulkUploadAggregate failed = workflow.validate(upload.getId());
            assertEquals(BulkUploadStatus.VALIDATION_FAILED, failed.getStatus());
            assertEquals(2, failed.getValidationErrors().size());
        }

        @Test
        @DisplayName("an upload cannot be processed before it validates")
        void processRequiresValidation() {
            BulkUploadAggregate upload = healthUpload();
            assertThrows(CommandValidationException.class, () -> workflow.process(upload.getId()));
            assertEquals(BulkUploadStatus.PENDING, uploads.get(upload.getId()).getStatus());
        }

        @Test
        @DisplayName("file that stops validating leaves the upload in error, and it can still be undone")
        void processingFailure() {
            BulkUploadAggregate upload = healthUpload();
            workflow.validate(upload.getId());
            students.unenroll(studentB.getId(), new Unenroll(studentB.getVersion()));

            assertThrows(CommandValidationException.class, () -> workflow.process(upload.getId()));
            assertEquals(BulkUploadStatus.ERROR, uploads.get(upload.getId()).getStatus());
            assertTrue(students.get(studentA.getId()).getHealthAssessments().isEmpty());

            assertEquals(BulkUploadStatus.INVALIDATED, workflow.undo(upload.getId()).getStatus());
        }
    }

    @Nested
    @DisplayName("grades")
    class Grades {

        @Test
        @DisplayName("grades carry the grading context and are removed on undo")
        void gradesProcessAndUndo() {
            Map<String, String> metadata = new HashMap<>();
            metadata.put(BulkUploadAggregate.SCHOOL_ID, schoolId);
            metadata.put(BulkUploadAggregate.SCHOOL_YEAR, "2023-2024");
            metadata.put(BulkUploadAggregate.GRADING_PERIOD, "2");
            metadata.put(BulkUploadAggregate.EFFECTIVE_DATE, "2024-01-15");
            BulkUploadAggregate upload = upload(TargetDomain.GRADES, "lrn,grade\n" + lrnA + ",91\n" + lrnB + ",78\n",
                metadata);

            workflow.validate(upload.getId());
            assertEquals(BulkUploadStatus.COMPLETED, workflow.process(upload.getId()).getStatus());

            GradeReport report = students.get(studentA.getId()).getGradeReports().get(0);
            assertEquals(91, report.grade());
            assertEquals(LocalDate.of(2024, 1, 15), report.testDate());
            assertEquals("2023-2024", report.schoolYear());
            assertEquals(2, report.gradingPeriod());

            workflow.undo(upload.getId());
            assertTrue(students.get(studentA.getId()).getGradeReports().isEmpty());
        }

        @Test
        @DisplayName("grade out of range fails validation")
        void gradeOutOfRange() {
            Map<String, String> metadata = new HashMap<>();
            metadata.put(BulkUploadAggregate.SCHOOL_ID, schoolId);
            metadata.put(BulkUploadAggregate.SCHOOL_YEAR, "2023-2024");
            metadata.put(BulkUploadAggregate.GRADING_PERIOD, "2");
            metadata.put(BulkUploadAggregate.EFFECTIVE_DATE, "2024-01-15");
            BulkUploadAggregate upload = upload(TargetDomain.GRADES, "lrn,grade\n" + lrnA + ",101\n", metadata);

            BulkUploadAggregate failed = workflow.validate(upload.getId());
            assertEquals(BulkUploadStatus.VALIDATION_FAILED, failed.getStatus());
            assertEquals("grade", failed.getValidationErrors().get(0).field());
        }
    }

    @Nested
    @DisplayName("new students")
    class NewStudents {

        @Test
        @DisplayName("students are created, enrolled and withdrawn again on undo")
        void createAndUndo() {
            String lrnC = "LRN-" + UUID.randomUUID();
            String lrnD = "LRN-" + UUID.randomUUID();
            BulkUploadAggregate upload = upload(TargetDomain.NEW_STUDENTS,
                "first_name,last_name,lrn,grade_level,date_of_birth,sex\n"
                    + "Carla,Dizon," + lrnC + ",3,2016-04-12,F\n"
                    + "Dino,Estrada," + lrnD + ",4,2015-09-30,male\n",
                Map.of(BulkUploadAggregate.SCHOOL_ID, schoolId));

            assertEquals(BulkUploadStatus.VALIDATED, workflow.validate(upload.getId()).getStatus());
            workflow.process(upload.getId());

            Optional<String> carla = students.findIdBySchoolStudentId(lrnC, schoolId);
            assertTrue(carla.isPresent());
            StudentAggregate created = students.get(carla.get());
            assertEquals(Sex.FEMALE, created.getSex());
            assertEquals(upload.getId(), created.getCreatedByBulkUploadId());
            assertEquals(schoolId, created.getSchoolId());

            workflow.undo(upload.getId());
            assertTrue(students.findIdBySchoolStudentId(lrnC, schoolId).isEmpty());
            assertTrue(students.findIdBySchoolStudentId(lrnD, schoolId).isEmpty());
            assertTrue(students.get(carla.get()).isDeleted());
        }

        @Test
        @DisplayName("learner already at the school fails validation")
        void duplicateLearner() {
            BulkUploadAggregate upload = upload(TargetDomain.NEW_STUDENTS,
                "first_name,last_name,lrn,grade_level,date_of_birth,sex\nAna,Upload," + lrnA + ",5,2013-02-01,F\n",
                Map.of(BulkUploadAggregate.SCHOOL_ID, schoolId));

            BulkUploadAggregate failed = workflow.validate(upload.getId());
            assertEquals(BulkUploadStatus.VALIDATION_FAILED, failed.getStatus());
            assertEquals(1, failed.getValidationErrors().get(0).row());
        }

        @Test
        @DisplayName("unknown school fails validation at file level")
        void unknownSchool() {
            BulkUploadAggregate upload = upload(TargetDomain.NEW_STUDENTS,
                "first_name,last_name,lrn,grade_level,date_of_birth,sex\nEli,Flores,LRN-x,2,2017-01-01,M\n",
                Map.of(BulkUploadAggregate.SCHOOL_ID, "school-" + UUID.randomUUID()));

            BulkUploadAggregate failed = workflow.validate(upload.getId());
            assertEquals(BulkUploadStatus.VALIDATION_FAILED, failed.getStatus());
            assertEquals(0, failed.getValidationErrors().get(0).row());
        }
    }
}
