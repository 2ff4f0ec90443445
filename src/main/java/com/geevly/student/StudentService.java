package com.geevly.student;

import com.geevly.config.GeevlyProperties;
import com.geevly.eventsourcing.AggregateNotFoundException;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.EventSourcedService;
import com.geevly.eventsourcing.IdAllocator;
import com.geevly.projection.PagedResult;
import com.geevly.projection.Paging;
import com.geevly.projection.ProjectionDispatcher;
import com.geevly.projection.RefreshMode;
import com.geevly.student.StudentCommands.AddGradeReport;
import com.geevly.student.StudentCommands.AddHealthAssessment;
import com.geevly.student.StudentCommands.CreateStudent;
import com.geevly.student.StudentCommands.Enroll;
import com.geevly.student.StudentCommands.Feed;
import com.geevly.student.StudentCommands.SetEligibility;
import com.geevly.student.StudentCommands.SetLookupCode;
import com.geevly.student.StudentCommands.SetProfilePhoto;
import com.geevly.student.StudentCommands.SetStatus;
import com.geevly.student.StudentCommands.Unenroll;
import com.geevly.student.StudentCommands.UpdateSponsorship;
import com.geevly.student.StudentCommands.UpdateStudent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

@Service
public class StudentService extends EventSourcedService<StudentAggregate> {

    private static final Logger log = LoggerFactory.getLogger(StudentService.class);

    private final StudentRepository students;
    private final IdAllocator idAllocator;
    private final StudentAntiCorruptionLayer acl;
    private final Clock clock;
    private final ZoneId feedingZone;
    private final int maxPageSize;

    public StudentService(StudentRepository students,
                          ProjectionDispatcher dispatcher,
                          IdAllocator idAllocator,
                          StudentAntiCorruptionLayer acl,
                          Clock clock,
                          GeevlyProperties properties) {
        super(students, dispatcher);
        this.students = students;
        this.idAllocator = idAllocator;
        this.acl = acl;
        this.clock = clock;
        this.feedingZone = properties.feeding().zoneId();
        this.maxPageSize = properties.paging().maxPageSize();
    }

    public StudentAggregate createStudent(CreateStudent cmd) {
        String id = String.valueOf(idAllocator.nextId(StudentAggregate.STREAM));
        StudentAggregate student = create(id, s -> s.create(cmd));
        log.info("Created student id={} bulkUpload={}", id, cmd.bulkUploadId());
        return student;
    }

    public StudentAggregate setStatus(String id, SetStatus cmd) {
        return execute(id, s -> s.setStatus(cmd));
    }

    public StudentAggregate update(String id, UpdateStudent cmd) {
        return execute(id, s -> s.update(cmd));
    }

    public StudentAggregate enroll(String id, Enroll cmd) {
        return execute(id, s -> s.enroll(cmd, acl));
    }

    public StudentAggregate unenroll(String id, Unenroll cmd) {
        return execute(id, s -> s.unenroll(cmd));
    }

    public StudentAggregate setLookupCode(String id, SetLookupCode cmd) {
        if (cmd.code() != null) {
            Optional<String> owner = students.findIdByCode(cmd.code().trim());
            if (owner.isPresent() && !owner.get().equals(id)) {
                throw new CommandValidationException("lookup code is already assigned to another student");
            }
        }
        return execute(id, s -> s.setLookupCode(cmd), RefreshMode.SYNC);
    }

    public StudentAggregate setProfilePhoto(String id, SetProfilePhoto cmd) {
        return execute(id, s -> s.setProfilePhoto(cmd, acl));
    }

    public StudentAggregate feed(String id, Feed cmd) {
        return execute(id, s -> s.feed(cmd, clock.instant(), feedingZone, acl));
    }

    public StudentAggregate setEligibility(String id, SetEligibility cmd) {
        return execute(id, s -> s.setEligibility(cmd));
    }

    public StudentAggregate updateSponsorship(String id, UpdateSponsorship cmd) {
        return execute(id, s -> s.updateSponsorship(cmd));
    }

    public StudentAggregate addGradeReport(String id, AddGradeReport cmd) {
        return execute(id, s -> s.addGradeReport(cmd), RefreshMode.SYNC);
    }

    public StudentAggregate removeGradeReport(String id, String bulkUploadId) {
        return execute(id, s -> s.removeGradeReport(bulkUploadId), RefreshMode.SYNC);
    }

    public StudentAggregate addHealthAssessment(String id, AddHealthAssessment cmd) {
        return execute(id, s -> s.addHealthAssessment(cmd, LocalDate.now(clock)), RefreshMode.SYNC);
    }

    public StudentAggregate removeHealthAssessment(String id, String bulkUploadId) {
        return execute(id, s -> s.removeHealthAssessment(bulkUploadId), RefreshMode.SYNC);
    }

    public StudentAggregate undoCreate(String id, String bulkUploadId) {
        StudentAggregate student = execute(id, s -> s.undoCreate(bulkUploadId), RefreshMode.SYNC);
        log.info("Withdrew student id={} created by bulkUpload={}", id, bulkUploadId);
        return student;
    }

    // queries

    public ProjectedStudent getProjected(String id) {
        return students.findProjected(id).orElseThrow(() -> new AggregateNotFoundException(StudentAggregate.STREAM, id));
    }

    public PagedResult<ProjectedStudent> list(StudentListFilter filter, Integer limit, Integer page) {
        return students.list(filter, Paging.of(limit, page, maxPageSize));
    }

    public long count(StudentListFilter filter) {
        return students.count(filter);
    }

    public List<ProjectedStudent> listForSchool(String schoolId) {
        return students.listForSchool(schoolId);
    }

    public StudentAggregate getByLookupCode(String code) {
        String id = students.findIdByCode(code)
            .orElseThrow(() -> new AggregateNotFoundException(StudentAggregate.STREAM, "code " + code));
        return get(id);
    }

    public Optional<String> findIdBySchoolStudentId(String studentSchoolId, String schoolId) {
        return students.findIdBySchoolStudentId(studentSchoolId, schoolId);
    }

    public List<FeedingHistoryEntry> feedingHistory(String schoolId, Instant from, Instant to) {
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("feeding history window is empty: " + from + " to " + to);
        }
        return students.feedingHistory(schoolId, from, to);
    }

    public long countFeedings(String studentId, Instant from, Instant to) {
        return students.countFeedings(studentId, from, to);
    }

    public List<ProjectedStudent> currentSponsorships(String sponsorId) {
        return students.sponsoredBy(sponsorId, LocalDate.now(clock));
    }
}
