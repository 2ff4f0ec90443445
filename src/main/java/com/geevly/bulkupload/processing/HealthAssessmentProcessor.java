package com.geevly.bulkupload.processing;

import com.geevly.bulkupload.BulkUploadAggregate;
import com.geevly.bulkupload.RecordType;
import com.geevly.bulkupload.TargetDomain;
import com.geevly.bulkupload.ValidationError;
import com.geevly.student.StudentCommands.AddHealthAssessment;
import com.geevly.student.StudentService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code lrn,height_cm,weight_kg,assessment_date}: one health assessment per student, tagged with
 * the upload id so undo can find it again.
 */
@Component
public class HealthAssessmentProcessor extends AbstractCsvProcessor<HealthAssessmentProcessor.HealthRow> {

    private static final List<String> COLUMNS = List.of("lrn", "height_cm", "weight_kg", "assessment_date");

    private final StudentService students;
    private final Clock clock;

    public HealthAssessmentProcessor(StudentService students, Clock clock) {
        this.students = students;
        this.clock = clock;
    }

    @Override
    public TargetDomain targetDomain() {
        return TargetDomain.HEALTH_ASSESSMENT;
    }

    @Override
    public RecordType recordType() {
        return RecordType.STUDENT;
    }

    @Override
    protected List<String> columns() {
        return COLUMNS;
    }

    @Override
    protected HealthRow parseRow(CsvTable.Row row, List<ValidationError> errors) {
        String lrn = required(row, "lrn", errors);
        Double height = positiveNumber(row, "height_cm", errors);
        Double weight = positiveNumber(row, "weight_kg", errors);
        LocalDate date = date(row, "assessment_date", errors);
        if (date != null && date.isAfter(LocalDate.now(clock))) {
            errors.add(new ValidationError(row.number(), "assessment_date", "assessment_date is in the future: " + date));
            return null;
        }
        if (lrn == null || height == null || weight == null || date == null) {
            return null;
        }
        return new HealthRow(row.number(), lrn, height, weight, date);
    }

    @Override
    protected void validateRows(BulkUploadAggregate upload, List<HealthRow> rows, List<ValidationError> errors) {
        LearnerLookup.resolve(students, schoolId(upload), rows, errors);
    }

    @Override
    public void process(BulkUploadAggregate upload, byte[] content, RecordTracker tracker) {
        List<HealthRow> rows = rows(upload, content);
        Map<String, String> ids = LearnerLookup.resolve(students, schoolId(upload), rows, new ArrayList<>());
        tracker.pending(List.copyOf(ids.values()));
        for (HealthRow row : rows) {
            String studentId = ids.get(row.lrn());
            students.addHealthAssessment(studentId,
                new AddHealthAssessment(row.assessmentDate(), upload.getId(), row.heightCm(), row.weightKg()));
            tracker.processed(studentId);
        }
    }

    @Override
    public void reverse(BulkUploadAggregate upload, String recordId) {
        students.removeHealthAssessment(recordId, upload.getId());
    }

    public record HealthRow(int row, String lrn, double heightCm, double weightKg, LocalDate assessmentDate)
        implements LearnerLookup.LearnerRow {}
}
