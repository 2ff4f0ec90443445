package com.geevly.student;

import com.geevly.eventsourcing.AggregateNotFoundException;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.VersionConflictException;
import com.geevly.projection.PagedResult;
import com.geevly.projection.ProjectionRebuilder;
import com.geevly.school.SchoolCommands.CreateSchool;
import com.geevly.school.SchoolService;
import com.geevly.student.StudentCommands.CreateStudent;
import com.geevly.student.StudentCommands.Enroll;
import com.geevly.student.StudentCommands.Feed;
import com.geevly.student.StudentCommands.SetLookupCode;
import com.geevly.student.StudentCommands.SetStatus;
import com.geevly.student.StudentCommands.UpdateSponsorship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class StudentServiceIntegrationTest {

    @Autowired StudentService students;
    @Autowired SchoolService schools;
    @Autowired ProjectionRebuilder rebuilder;

    private String schoolId;

    @BeforeEach
    void createSchool() {
        schoolId = schools.createSchool(new CreateSchool("Student Test School " + UUID.randomUUID(), null, null)).getId();
    }

    private StudentAggregate enrolledStudent(String lastName) {
        StudentAggregate student = students.createStudent(
            new CreateStudent("Lia", lastName, LocalDate.of(2013, 6, 1), Sex.FEMALE, 5, null));
        return students.enroll(student.getId(), new Enroll(student.getVersion(), schoolId, LocalDate.now()));
    }

    @Test
    @DisplayName("created and enrolled student appears in the projection")
    void createAndEnroll() {
        StudentAggregate student = enrolledStudent("Reyes");

        ProjectedStudent projected = students.getProjected(student.getId());
        assertEquals("Reyes", projected.lastName());
        assertEquals(schoolId, projected.schoolId());
        assertEquals(StudentStatus.INACTIVE, projected.status());
        assertEquals(2, projected.version());
        assertEquals(1, students.listForSchool(schoolId).size());
    }

    @Test
    @DisplayName("ids are handed out sequentially")
    void sequentialIds() {
        long first = Long.parseLong(students.createStudent(
            new CreateStudent("A", "One", LocalDate.of(2012, 1, 1), Sex.MALE, 6, null)).getId());
        long second = Long.parseLong(students.createStudent(
            new CreateStudent("B", "Two", LocalDate.of(2012, 1, 1), Sex.MALE, 6, null)).getId());
        assertEquals(first + 1, second);
    }

    @Test
    @DisplayName("enrolling in an unknown school is a validation error")
    void unknownSchool() {
        StudentAggregate student = students.createStudent(
            new CreateStudent("Lia", "Cruz", LocalDate.of(2013, 6, 1), Sex.FEMALE, 5, null));
        assertThrows(CommandValidationException.class, () -> students.enroll(student.getId(),
            new Enroll(1, "no-such-school", LocalDate.now())));
    }

    @Test
    @DisplayName("stale version is a conflict")
    void staleVersion() {
        StudentAggregate student = enrolledStudent("Garcia");
        assertThrows(VersionConflictException.class,
            () -> students.setStatus(student.getId(), new SetStatus(1, StudentStatus.ACTIVE)));
    }

    @Test
    @DisplayName("unknown student is not found")
    void unknownStudent() {
        assertThrows(AggregateNotFoundException.class, () -> students.getProjected("no-such-student"));
        assertThrows(AggregateNotFoundException.class,
            () -> students.setStatus("no-such-student", new SetStatus(0, StudentStatus.ACTIVE)));
    }

    @Test
    @DisplayName("feedings land in the school feeding history and counts")
    void feedings() {
        StudentAggregate student = enrolledStudent("Bautista");
        Instant twoDaysAgo = Instant.now().minus(2, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);
        Instant yesterday = twoDaysAgo.plus(1, ChronoUnit.DAYS);

        student = students.feed(student.getId(), new Feed(student.getVersion(), twoDaysAgo, null));
        student = students.feed(student.getId(), new Feed(student.getVersion(), yesterday, null));
        StudentAggregate fed = student;
        assertThrows(CommandValidationException.class,
            () -> students.feed(fed.getId(), new Feed(fed.getVersion(), yesterday, null)));

        Instant from = twoDaysAgo.minus(1, ChronoUnit.HOURS);
        Instant to = Instant.now().plus(1, ChronoUnit.HOURS);
        List<FeedingHistoryEntry> history = students.feedingHistory(schoolId, from, to);
        assertEquals(1, history.size());
        assertEquals(List.of(twoDaysAgo, yesterday), history.get(0).feedings());
        assertEquals(2, students.countFeedings(student.getId(), from, to));
        assertEquals(1, students.countFeedings(student.getId(), from, yesterday));

        ProjectedStudent projected = students.getProjected(student.getId());
        assertEquals(2, projected.feedingCount());
        assertEquals(yesterday, projected.lastFeedingAt());
    }

    @Test
    @DisplayName("empty feeding history window is rejected")
    void emptyWindow() {
        Instant now = Instant.now();
        assertThrows(IllegalArgumentException.class, () -> students.feedingHistory(schoolId, now, now));
    }

    @Test
    @DisplayName("lookup code resolves to one student only")
    void lookupCode() {
        String code = "QR-" + UUID.randomUUID();
        StudentAggregate first = enrolledStudent("Lim");
        StudentAggregate second = enrolledStudent("Tan");

        students.setLookupCode(first.getId(), new SetLookupCode(first.getVersion(), code));
        assertEquals(first.getId(), students.getByLookupCode(code).getId());
        assertThrows(CommandValidationException.class,
            () -> students.setLookupCode(second.getId(), new SetLookupCode(second.getVersion(), code)));
        assertThrows(AggregateNotFoundException.class, () -> students.getByLookupCode("QR-unknown-" + code));
    }

    @Test
    @DisplayName("current sponsorships are listed per sponsor")
    void sponsorships() {
        String sponsor = "sponsor-" + UUID.randomUUID();
        StudentAggregate current = enrolledStudent("Villanueva");
        StudentAggregate ended = enrolledStudent("Mendoza");

        students.updateSponsorship(current.getId(), new UpdateSponsorship(current.getVersion(), sponsor,
            LocalDate.now().minusMonths(1), null));
        students.updateSponsorship(ended.getId(), new UpdateSponsorship(ended.getVersion(), sponsor,
            LocalDate.now().minusMonths(6), LocalDate.now().minusMonths(2)));

        List<ProjectedStudent> sponsored = students.currentSponsorships(sponsor);
        assertEquals(List.of(current.getId()), sponsored.stream().map(ProjectedStudent::id).toList());
    }

    @Test
    @DisplayName("school filter and paging narrow the list")
    void listFilter() {
        enrolledStudent("Aquino");
        enrolledStudent("Bonifacio");
        enrolledStudent("Castillo");

        StudentListFilter filter = new StudentListFilter(false, false, List.of(schoolId), null, null, null);
        PagedResult<ProjectedStudent> page = students.list(filter, 2, 1);
        assertEquals(3, page.count());
        assertEquals(2, page.items().size());
        assertEquals("Aquino", page.items().get(0).lastName());

        PagedResult<ProjectedStudent> search = students.list(
            new StudentListFilter(false, false, List.of(schoolId), null, null, "bonif"), null, null);
        assertEquals(1, search.count());
    }

    @Test
    @DisplayName("rebuilt projection matches the incrementally maintained one")
    void rebuildMatches() {
        StudentAggregate student = enrolledStudent("Rizal");
        student = students.feed(student.getId(),
            new Feed(student.getVersion(), Instant.now().minus(1, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS), null));
        ProjectedStudent before = students.getProjected(student.getId());

        rebuilder.rebuild(StudentAggregate.STREAM);

        assertEquals(before, students.getProjected(student.getId()));
    }
}
