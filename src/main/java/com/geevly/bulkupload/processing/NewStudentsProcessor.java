package com.geevly.bulkupload.processing;

import com.geevly.bulkupload.BulkUploadAggregate;
import com.geevly.bulkupload.RecordType;
import com.geevly.bulkupload.TargetDomain;
import com.geevly.bulkupload.ValidationError;
import com.geevly.eventsourcing.DomainException;
import com.geevly.school.SchoolService;
import com.geevly.student.Sex;
import com.geevly.student.StudentAggregate;
import com.geevly.student.StudentCommands.CreateStudent;
import com.geevly.student.StudentCommands.Enroll;
import com.geevly.student.StudentService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code first_name,last_name,lrn,grade_level,date_of_birth,sex}: creates each student and
 * enrolls them at the upload's school. Undo withdraws the students this upload created.
 */
@Component
public class NewStudentsProcessor extends AbstractCsvProcessor<NewStudentsProcessor.StudentRow> {

    private static final List<String> COLUMNS =
        List.of("first_name", "last_name", "lrn", "grade_level", "date_of_birth", "sex");

    private final StudentService students;
    private final SchoolService schools;
    private final Clock clock;

    public NewStudentsProcessor(StudentService students, SchoolService schools, Clock clock) {
        this.students = students;
        this.schools = schools;
        this.clock = clock;
    }

    @Override
    public TargetDomain targetDomain() {
        return TargetDomain.NEW_STUDENTS;
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
    protected StudentRow parseRow(CsvTable.Row row, List<ValidationError> errors) {
        String firstName = required(row, "first_name", errors);
        String lastName = required(row, "last_name", errors);
        String lrn = required(row, "lrn", errors);
        Integer gradeLevel = integer(row, "grade_level", 0, 12, errors);
        LocalDate dateOfBirth = date(row, "date_of_birth", errors);
        if (dateOfBirth != null && dateOfBirth.isAfter(LocalDate.now(clock))) {
            errors.add(new ValidationError(row.number(), "date_of_birth", "date_of_birth is in the future: " + dateOfBirth));
            return null;
        }
        Sex sex;
        try {
            sex = Sex.fromValue(row.get("sex"));
        } catch (IllegalArgumentException ex) {
            errors.add(new ValidationError(row.number(), "sex", ex.getMessage()));
            return null;
        }
        if (firstName == null || lastName == null || lrn == null || gradeLevel == null || dateOfBirth == null) {
            return null;
        }
        return new StudentRow(row.number(), firstName, lastName, lrn, gradeLevel, dateOfBirth, sex);
    }

    @Override
    protected void validateRows(BulkUploadAggregate upload, List<StudentRow> rows, List<ValidationError> errors) {
        String schoolId = schoolId(upload);
        try {
            schools.validateSchoolId(schoolId);
        } catch (DomainException ex) {
            errors.add(new ValidationError(0, BulkUploadAggregate.SCHOOL_ID, ex.getMessage()));
            return;
        }
        Set<String> seen = new HashSet<>();
        for (StudentRow row : rows) {
            if (!seen.add(row.lrn())) {
                errors.add(new ValidationError(row.row(), "lrn", "lrn " + row.lrn() + " appears more than once"));
            } else if (students.findIdBySchoolStudentId(row.lrn(), schoolId).isPresent()) {
                errors.add(new ValidationError(row.row(), "lrn",
                    "a student with lrn " + row.lrn() + " is already enrolled at school " + schoolId));
            }
        }
    }

    @Override
    public void process(BulkUploadAggregate upload, byte[] content, RecordTracker tracker) {
        String schoolId = schoolId(upload);
        LocalDate today = LocalDate.now(clock);
        for (StudentRow row : rows(upload, content)) {
            StudentAggregate student = students.createStudent(new CreateStudent(row.firstName(), row.lastName(),
                row.dateOfBirth(), row.sex(), row.gradeLevel(), row.lrn(), upload.getId()));
            tracker.pending(List.of(student.getId()));
            tracker.processed(student.getId());
            students.enroll(student.getId(), new Enroll(student.getVersion(), schoolId, today));
        }
    }

    @Override
    public void reverse(BulkUploadAggregate upload, String recordId) {
        students.undoCreate(recordId, upload.getId());
    }

    public record StudentRow(int row, String firstName, String lastName, String lrn, int gradeLevel,
                             LocalDate dateOfBirth, Sex sex) {}
}
