package com.geevly.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.projection.PagedResult;
import com.geevly.student.FeedingHistoryEntry;
import com.geevly.student.ProjectedStudent;
import com.geevly.student.Sex;
import com.geevly.student.StudentAggregate;
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
import com.geevly.student.StudentListFilter;
import com.geevly.student.StudentService;
import com.geevly.student.StudentStatus;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.format.annotation.DateTimeFormat.ISO;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class StudentController {

    private final StudentService students;
    private final PayloadCodec codec;

    public StudentController(StudentService students, PayloadCodec codec) {
        this.students = students;
        this.codec = codec;
    }

    @PostMapping("/students")
    @ResponseStatus(HttpStatus.CREATED)
    public CommandResult create(@RequestBody StudentRequest request) {
        return CommandResult.of(students.createStudent(new CreateStudent(request.firstName(), request.lastName(),
            request.dateOfBirth(), request.sex(), request.gradeLevel(), request.studentSchoolId())));
    }

    @GetMapping("/students")
    public PagedResult<ProjectedStudent> list(
            @RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly,
            @RequestParam(name = "eligible_only", defaultValue = "false") boolean eligibleOnly,
            @RequestParam(name = "school_id", required = false) List<String> schoolIds,
            @RequestParam(name = "born_after", required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate bornAfter,
            @RequestParam(name = "born_before", required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate bornBefore,
            @RequestParam(name = "q", required = false) String nameSearch,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer page) {
        StudentListFilter filter = new StudentListFilter(activeOnly, eligibleOnly, schoolIds, bornAfter, bornBefore,
            nameSearch);
        return students.list(filter, limit, page);
    }

    @GetMapping("/students/{id}")
    public ProjectedStudent get(@PathVariable String id) {
        return students.getProjected(id);
    }

    @GetMapping("/students/{id}/history")
    public List<EventView> history(@PathVariable String id) {
        return students.history(id).stream().map(e -> EventView.of(e, codec)).toList();
    }

    @GetMapping("/students/{id}/events/{version}")
    public EventView event(@PathVariable String id, @PathVariable long version) {
        return EventView.of(students.event(id, version), codec);
    }

    @GetMapping("/students/by-code/{code}")
    public Map<String, Object> byLookupCode(@PathVariable String code) {
        StudentAggregate student = students.getByLookupCode(code);
        return Map.of(
            "id", student.getId(),
            "first_name", student.getFirstName(),
            "last_name", student.getLastName(),
            "version", student.getVersion()
        );
    }

    @PutMapping("/students/{id}")
    public CommandResult update(@PathVariable String id, @RequestBody StudentRequest request) {
        return CommandResult.of(students.update(id, new UpdateStudent(request.expectedVersion(), request.firstName(),
            request.lastName(), request.dateOfBirth(), request.sex(), request.gradeLevel(), request.studentSchoolId())));
    }

    @PostMapping("/students/{id}/status")
    public CommandResult setStatus(@PathVariable String id, @RequestBody StatusRequest request) {
        return CommandResult.of(students.setStatus(id, new SetStatus(request.expectedVersion(), request.status())));
    }

    @PostMapping("/students/{id}/enrollment")
    public CommandResult enroll(@PathVariable String id, @RequestBody EnrollRequest request) {
        return CommandResult.of(students.enroll(id,
            new Enroll(request.expectedVersion(), request.schoolId(), request.dateOfEnrollment())));
    }

    @DeleteMapping("/students/{id}/enrollment")
    public CommandResult unenroll(@PathVariable String id, @RequestParam("expected_version") long expectedVersion) {
        return CommandResult.of(students.unenroll(id, new Unenroll(expectedVersion)));
    }

    @PostMapping("/students/{id}/lookup-code")
    public CommandResult setLookupCode(@PathVariable String id, @RequestBody LookupCodeRequest request) {
        return CommandResult.of(students.setLookupCode(id, new SetLookupCode(request.expectedVersion(), request.code())));
    }

    @PostMapping("/students/{id}/profile-photo")
    public CommandResult setProfilePhoto(@PathVariable String id, @RequestBody FileReferenceRequest request) {
        return CommandResult.of(students.setProfilePhoto(id,
            new SetProfilePhoto(request.expectedVersion(), request.fileId())));
    }

    @PostMapping("/students/{id}/feedings")
    public CommandResult feed(@PathVariable String id, @RequestBody FeedRequest request) {
        return CommandResult.of(students.feed(id,
            new Feed(request.expectedVersion(), request.timestamp(), request.fileId())));
    }

    @PostMapping("/students/{id}/eligibility")
    public CommandResult setEligibility(@PathVariable String id, @RequestBody EligibilityRequest request) {
        return CommandResult.of(students.setEligibility(id,
            new SetEligibility(request.expectedVersion(), request.eligible())));
    }

    @PostMapping("/students/{id}/sponsorship")
    public CommandResult updateSponsorship(@PathVariable String id, @RequestBody SponsorshipRequest request) {
        return CommandResult.of(students.updateSponsorship(id, new UpdateSponsorship(request.expectedVersion(),
            request.sponsorId(), request.startDate(), request.endDate())));
    }

    @GetMapping("/students/{id}/feedings/count")
    public Map<String, Object> countFeedings(@PathVariable String id,
                                             @RequestParam Instant from,
                                             @RequestParam Instant to) {
        return Map.of("student_id", id, "count", students.countFeedings(id, from, to));
    }

    @GetMapping("/schools/{schoolId}/feedings")
    public List<FeedingHistoryEntry> feedingHistory(@PathVariable String schoolId,
                                                    @RequestParam Instant from,
                                                    @RequestParam Instant to) {
        return students.feedingHistory(schoolId, from, to);
    }

    @GetMapping("/sponsors/{sponsorId}/students")
    public List<ProjectedStudent> sponsoredStudents(@PathVariable String sponsorId) {
        return students.currentSponsorships(sponsorId);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record StudentRequest(long expectedVersion, String firstName, String lastName, LocalDate dateOfBirth,
                                 Sex sex, int gradeLevel, String studentSchoolId) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record StatusRequest(long expectedVersion, StudentStatus status) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record EnrollRequest(long expectedVersion, String schoolId, LocalDate dateOfEnrollment) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record LookupCodeRequest(long expectedVersion, String code) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record FileReferenceRequest(long expectedVersion, String fileId) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record FeedRequest(long expectedVersion, Instant timestamp, String fileId) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record EligibilityRequest(long expectedVersion, boolean eligible) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SponsorshipRequest(long expectedVersion, String sponsorId, LocalDate startDate, LocalDate endDate) {}
}
