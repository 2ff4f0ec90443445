package com.geevly.bulkupload.processing;

import com.geevly.bulkupload.BulkUploadAggregate;
import com.geevly.bulkupload.RecordType;
import com.geevly.bulkupload.TargetDomain;
import com.geevly.bulkupload.ValidationError;
import com.geevly.student.StudentCommands.AddGradeReport;
import com.geevly.student.StudentService;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code lrn,grade}: one grade report per student. Test date, school year and grading period come
 * from the upload metadata.
 */
@Component
public class GradesProcessor extends AbstractCsvProcessor<GradesProcessor.GradeRow> {

    private static final List<String> COLUMNS = List.of("lrn", "grade");

    private final StudentService students;

    public GradesProcessor(StudentService students) {
        this.students = students;
    }

    @Override
    public TargetDomain targetDomain() {
        return TargetDomain.GRADES;
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
    protected GradeRow parseRow(CsvTable.Row row, List<ValidationError> errors) {
        String lrn = required(row, "lrn", errors);
        Integer grade = integer(row, "grade", 0, 100, errors);
        if (lrn == null || grade == null) {
            return null;
        }
        return new GradeRow(row.number(), lrn, grade);
    }

    @Override
    protected void validateRows(BulkUploadAggregate upload, List<GradeRow> rows, List<ValidationError> errors) {
        LearnerLookup.resolve(students, schoolId(upload), rows, errors);
    }

    @Override
    public void process(BulkUploadAggregate upload, byte[] content, RecordTracker tracker) {
        List<GradeRow> rows = rows(upload, content);
        LocalDate testDate = LocalDate.parse(metadata(upload, BulkUploadAggregate.EFFECTIVE_DATE));
        String schoolYear = metadata(upload, BulkUploadAggregate.SCHOOL_YEAR);
        int gradingPeriod = Integer.parseInt(metadata(upload, BulkUploadAggregate.GRADING_PERIOD));

        Map<String, String> ids = LearnerLookup.resolve(students, schoolId(upload), rows, new ArrayList<>());
        tracker.pending(List.copyOf(ids.values()));
        for (GradeRow row : rows) {
            String studentId = ids.get(row.lrn());
            students.addGradeReport(studentId,
                new AddGradeReport(row.grade(), testDate, upload.getId(), schoolYear, gradingPeriod));
            tracker.processed(studentId);
        }
    }

    @Override
    public void reverse(BulkUploadAggregate upload, String recordId) {
        students.removeGradeReport(recordId, upload.getId());
    }

    private static String metadata(BulkUploadAggregate upload, String key) {
        return upload.metadata(key)
            .orElseThrow(() -> new IllegalStateException("upload " + upload.getId() + " has no " + key));
    }

    public record GradeRow(int row, String lrn, int grade) implements LearnerLookup.LearnerRow {}
}
