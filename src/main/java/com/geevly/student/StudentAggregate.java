package com.geevly.student;

import com.geevly.eventsourcing.AggregateNotFoundException;
import com.geevly.eventsourcing.AggregateRoot;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.Event;
import com.geevly.eventsourcing.EventRouter;
import com.geevly.eventsourcing.NotFoundException;
import com.geevly.eventsourcing.PayloadCodec;
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
import com.geevly.student.StudentEvents.Created;
import com.geevly.student.StudentEvents.CreationUndone;
import com.geevly.student.StudentEvents.EligibilitySet;
import com.geevly.student.StudentEvents.Enrolled;
import com.geevly.student.StudentEvents.Fed;
import com.geevly.student.StudentEvents.GradeReportAdded;
import com.geevly.student.StudentEvents.GradeReportRemoved;
import com.geevly.student.StudentEvents.HealthAssessmentAdded;
import com.geevly.student.StudentEvents.HealthAssessmentRemoved;
import com.geevly.student.StudentEvents.LookupCodeSet;
import com.geevly.student.StudentEvents.ProfilePhotoSet;
import com.geevly.student.StudentEvents.SponsorshipUpdated;
import com.geevly.student.StudentEvents.StatusSet;
import com.geevly.student.StudentEvents.Unenrolled;
import com.geevly.student.StudentEvents.Updated;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class StudentAggregate extends AggregateRoot<StudentAggregate> {

    public static final String STREAM = "student";

    private static final EventRouter<StudentAggregate> ROUTER = EventRouter
        .<StudentAggregate, StudentEventType>builder(STREAM, StudentEventType.class)
        .creation(StudentEventType.CREATED, Created.class, StudentAggregate::onCreated)
        .on(StudentEventType.STATUS_SET, StatusSet.class, (s, p, e) -> s.status = p.status())
        .on(StudentEventType.UPDATED, Updated.class, StudentAggregate::onUpdated)
        .on(StudentEventType.ENROLLED, Enrolled.class, StudentAggregate::onEnrolled)
        .on(StudentEventType.UNENROLLED, Unenrolled.class, StudentAggregate::onUnenrolled)
        .on(StudentEventType.LOOKUP_CODE_SET, LookupCodeSet.class, (s, p, e) -> s.lookupCode = p.code())
        .on(StudentEventType.PROFILE_PHOTO_SET, ProfilePhotoSet.class, (s, p, e) -> s.profilePhotoId = p.fileId())
        .on(StudentEventType.FED, Fed.class, StudentAggregate::onFed)
        .on(StudentEventType.ELIGIBILITY_SET, EligibilitySet.class, (s, p, e) -> s.eligibleForSponsorship = p.eligible())
        .on(StudentEventType.SPONSORSHIP_UPDATED, SponsorshipUpdated.class, StudentAggregate::onSponsorshipUpdated)
        .on(StudentEventType.GRADE_REPORT_ADDED, GradeReportAdded.class, StudentAggregate::onGradeReportAdded)
        .on(StudentEventType.GRADE_REPORT_REMOVED, GradeReportRemoved.class,
            (s, p, e) -> s.gradeReports.removeIf(r -> Objects.equals(r.bulkUploadId(), p.bulkUploadId())))
        .on(StudentEventType.HEALTH_ASSESSMENT_ADDED, HealthAssessmentAdded.class, StudentAggregate::onHealthAssessmentAdded)
        .on(StudentEventType.HEALTH_ASSESSMENT_REMOVED, HealthAssessmentRemoved.class,
            (s, p, e) -> s.healthAssessments.removeIf(h -> Objects.equals(h.bulkUploadId(), p.bulkUploadId())))
        .on(StudentEventType.CREATION_UNDONE, CreationUndone.class, (s, p, e) -> s.deleted = true)
        .build();

    private boolean created;
    private boolean deleted;
    private String firstName;
    private String lastName;
    private LocalDate dateOfBirth;
    private Sex sex;
    private int gradeLevel;
    private String studentSchoolId;
    private String createdByBulkUploadId;
    private StudentStatus status;
    private String schoolId;
    private LocalDate dateOfEnrollment;
    private String lookupCode;
    private String profilePhotoId;
    private boolean eligibleForSponsorship;
    private final List<SponsorshipRecord> sponsorships = new ArrayList<>();
    private final List<FeedingRecord> feedings = new ArrayList<>();
    private final List<GradeReport> gradeReports = new ArrayList<>();
    private final List<HealthAssessment> healthAssessments = new ArrayList<>();

    public StudentAggregate(String id, PayloadCodec codec) {
        super(id, codec);
    }

    public StudentAggregate(String id, PayloadCodec codec, Clock clock) {
        super(id, codec, clock);
    }

    @Override
    protected EventRouter<StudentAggregate> router() {
        return ROUTER;
    }

    @Override
    protected StudentAggregate self() {
        return this;
    }

    @Override
    public boolean exists() {
        return created;
    }

    /**
     * Undone students stay in the log but behave as absent for every command.
     */
    @Override
    protected void requireExists() {
        if (!created || deleted) {
            throw new AggregateNotFoundException(STREAM, getId());
        }
    }

    // commands

    public Event create(CreateStudent cmd) {
        requireCreatable();
        requireName(cmd.firstName(), cmd.lastName());
        if (cmd.dateOfBirth() == null) {
            throw new CommandValidationException("date of birth is required");
        }
        if (cmd.gradeLevel() < 0) {
            throw new CommandValidationException("grade level cannot be negative");
        }
        return raise(StudentEventType.CREATED, new Created(cmd.firstName().trim(), cmd.lastName().trim(),
            cmd.dateOfBirth(), cmd.sex() == null ? Sex.UNSPECIFIED : cmd.sex(), cmd.gradeLevel(),
            blankToNull(cmd.studentSchoolId()), cmd.bulkUploadId()));
    }

    public Event setStatus(SetStatus cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        if (cmd.status() == null) {
            throw new CommandValidationException("status is required");
        }
        return raise(StudentEventType.STATUS_SET, new StatusSet(cmd.status()));
    }

    public Event update(UpdateStudent cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        requireName(cmd.firstName(), cmd.lastName());
        if (cmd.dateOfBirth() == null) {
            throw new CommandValidationException("date of birth is required");
        }
        return raise(StudentEventType.UPDATED, new Updated(cmd.firstName().trim(), cmd.lastName().trim(),
            cmd.dateOfBirth(), cmd.sex() == null ? Sex.UNSPECIFIED : cmd.sex(), cmd.gradeLevel(),
            blankToNull(cmd.studentSchoolId())));
    }

    public Event enroll(Enroll cmd, StudentAntiCorruptionLayer acl) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        if (cmd.schoolId() == null || cmd.schoolId().isBlank()) {
            throw new CommandValidationException("school id is required");
        }
        if (cmd.dateOfEnrollment() == null) {
            throw new CommandValidationException("date of enrollment is required");
        }
        acl.validateSchoolId(cmd.schoolId());
        return raise(StudentEventType.ENROLLED, new Enrolled(cmd.schoolId(), cmd.dateOfEnrollment()));
    }

    public Event unenroll(Unenroll cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        if (schoolId == null) {
            throw new CommandValidationException("student " + getId() + " is not enrolled");
        }
        return raise(StudentEventType.UNENROLLED, new Unenrolled(schoolId));
    }

    public Event setLookupCode(SetLookupCode cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        if (cmd.code() == null || cmd.code().isBlank()) {
            throw new CommandValidationException("lookup code is required");
        }
        return raise(StudentEventType.LOOKUP_CODE_SET, new LookupCodeSet(cmd.code().trim()));
    }

    public Event setProfilePhoto(SetProfilePhoto cmd, StudentAntiCorruptionLayer acl) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        if (cmd.fileId() == null || cmd.fileId().isBlank()) {
            throw new CommandValidationException("photo file id is required");
        }
        acl.validatePhotoId(cmd.fileId());
        return raise(StudentEventType.PROFILE_PHOTO_SET, new ProfilePhotoSet(cmd.fileId()));
    }

    /**
     * Records a feeding. Once a student has been fed, a new feeding must be later than the last
     * one and fall on another calendar day in {@code zone}. No feeding may lie in the future.
     */
    public Event feed(Feed cmd, Instant now, ZoneId zone, StudentAntiCorruptionLayer acl) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        Instant timestamp = cmd.timestamp();
        if (timestamp == null) {
            throw new CommandValidationException("feeding timestamp is required");
        }
        FeedingRecord last = lastFeeding();
        if (last != null && !timestamp.isAfter(last.timestamp())) {
            throw new CommandValidationException("feeding at " + timestamp
                + " is not after the last feeding at " + last.timestamp());
        }
        if (timestamp.isAfter(now)) {
            throw new CommandValidationException("feeding at " + timestamp + " is in the future");
        }
        if (last != null) {
            LocalDate day = timestamp.atZone(zone).toLocalDate();
            if (day.equals(last.timestamp().atZone(zone).toLocalDate())) {
                throw new CommandValidationException("student " + getId() + " was already fed on " + day);
            }
        }
        if (cmd.fileId() != null) {
            acl.validateFileId(cmd.fileId());
        }
        return raise(StudentEventType.FED, new Fed(timestamp, cmd.fileId(), schoolId), now);
    }

    public Event setEligibility(SetEligibility cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        return raise(StudentEventType.ELIGIBILITY_SET, new EligibilitySet(cmd.eligible()));
    }

    public Event updateSponsorship(UpdateSponsorship cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        if (cmd.sponsorId() == null || cmd.sponsorId().isBlank()) {
            throw new CommandValidationException("sponsor id is required");
        }
        if (cmd.startDate() == null) {
            throw new CommandValidationException("sponsorship start date is required");
        }
        if (cmd.endDate() != null && cmd.endDate().isBefore(cmd.startDate())) {
            throw new CommandValidationException("sponsorship cannot end before it starts");
        }
        return raise(StudentEventType.SPONSORSHIP_UPDATED,
            new SponsorshipUpdated(cmd.sponsorId(), cmd.startDate(), cmd.endDate()));
    }

    public Event addGradeReport(AddGradeReport cmd) {
        requireExists();
        if (cmd.grade() < 0 || cmd.grade() > 100) {
            throw new CommandValidationException("grade must be between 0 and 100: " + cmd.grade());
        }
        if (cmd.testDate() == null) {
            throw new CommandValidationException("test date is required");
        }
        if (cmd.bulkUploadId() != null && gradeReport(cmd.bulkUploadId()) != null) {
            throw new CommandValidationException("student " + getId() + " already has a grade report from upload "
                + cmd.bulkUploadId());
        }
        return raise(StudentEventType.GRADE_REPORT_ADDED, new GradeReportAdded(cmd.grade(), cmd.testDate(),
            cmd.bulkUploadId(), cmd.schoolYear(), cmd.gradingPeriod()));
    }

    public Event removeGradeReport(String bulkUploadId) {
        requireExists();
        if (gradeReport(bulkUploadId) == null) {
            throw new NotFoundException("student " + getId() + " has no grade report from upload " + bulkUploadId);
        }
        return raise(StudentEventType.GRADE_REPORT_REMOVED, new GradeReportRemoved(bulkUploadId));
    }

    public Event addHealthAssessment(AddHealthAssessment cmd, LocalDate today) {
        requireExists();
        if (!(cmd.heightCm() > 0) || !(cmd.weightKg() > 0)) {
            throw new CommandValidationException("height and weight must be positive");
        }
        if (cmd.assessmentDate() == null) {
            throw new CommandValidationException("assessment date is required");
        }
        if (cmd.assessmentDate().isAfter(today)) {
            throw new CommandValidationException("assessment date " + cmd.assessmentDate() + " is in the future");
        }
        if (cmd.bulkUploadId() != null && healthAssessment(cmd.bulkUploadId()) != null) {
            throw new CommandValidationException("student " + getId() + " already has a health assessment from upload "
                + cmd.bulkUploadId());
        }
        return raise(StudentEventType.HEALTH_ASSESSMENT_ADDED, new HealthAssessmentAdded(cmd.assessmentDate(),
            cmd.bulkUploadId(), cmd.heightCm(), cmd.weightKg()));
    }

    public Event removeHealthAssessment(String bulkUploadId) {
        requireExists();
        if (healthAssessment(bulkUploadId) == null) {
            throw new NotFoundException("student " + getId() + " has no health assessment from upload " + bulkUploadId);
        }
        return raise(StudentEventType.HEALTH_ASSESSMENT_REMOVED, new HealthAssessmentRemoved(bulkUploadId));
    }

    /**
     * Withdraws a student that a bulk upload created. Only that upload may withdraw it.
     */
    public Event undoCreate(String bulkUploadId) {
        requireExists();
        if (bulkUploadId == null || !bulkUploadId.equals(createdByBulkUploadId)) {
            throw new CommandValidationException("student " + getId() + " was not created by upload " + bulkUploadId);
        }
        return raise(StudentEventType.CREATION_UNDONE, new CreationUndone(bulkUploadId));
    }

    // event handlers

    private void onCreated(Created p, Event e) {
        created = true;
        firstName = p.firstName();
        lastName = p.lastName();
        dateOfBirth = p.dateOfBirth();
        sex = p.sex();
        gradeLevel = p.gradeLevel();
        studentSchoolId = p.studentSchoolId();
        createdByBulkUploadId = p.bulkUploadId();
        status = StudentStatus.INACTIVE;
    }

    private void onUpdated(Updated p, Event e) {
        firstName = p.firstName();
        lastName = p.lastName();
        dateOfBirth = p.dateOfBirth();
        sex = p.sex();
        gradeLevel = p.gradeLevel();
        studentSchoolId = p.studentSchoolId();
    }

    private void onEnrolled(Enrolled p, Event e) {
        schoolId = p.schoolId();
        dateOfEnrollment = p.dateOfEnrollment();
    }

    private void onUnenrolled(Unenrolled p, Event e) {
        schoolId = null;
        dateOfEnrollment = null;
    }

    private void onFed(Fed p, Event e) {
        feedings.add(new FeedingRecord(p.timestamp(), p.fileId(), p.schoolId()));
    }

    private void onSponsorshipUpdated(SponsorshipUpdated p, Event e) {
        sponsorships.add(new SponsorshipRecord(p.sponsorId(), p.startDate(), p.endDate()));
    }

    private void onGradeReportAdded(GradeReportAdded p, Event e) {
        gradeReports.add(new GradeReport(p.grade(), p.testDate(), p.bulkUploadId(), p.schoolYear(), p.gradingPeriod()));
    }

    private void onHealthAssessmentAdded(HealthAssessmentAdded p, Event e) {
        healthAssessments.add(new HealthAssessment(p.assessmentDate(), p.bulkUploadId(), p.heightCm(), p.weightKg()));
    }

    // state

    public boolean isDeleted() {
        return deleted;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public LocalDate getDateOfBirth() {
        return dateOfBirth;
    }

    public Sex getSex() {
        return sex;
    }

    public int getGradeLevel() {
        return gradeLevel;
    }

    public String getStudentSchoolId() {
        return studentSchoolId;
    }

    public String getCreatedByBulkUploadId() {
        return createdByBulkUploadId;
    }

    public StudentStatus getStatus() {
        return status;
    }

    public String getSchoolId() {
        return schoolId;
    }

    public LocalDate getDateOfEnrollment() {
        return dateOfEnrollment;
    }

    public String getLookupCode() {
        return lookupCode;
    }

    public String getProfilePhotoId() {
        return profilePhotoId;
    }

    public boolean isEligibleForSponsorship() {
        return eligibleForSponsorship;
    }

    public List<SponsorshipRecord> getSponsorships() {
        return List.copyOf(sponsorships);
    }

    public List<FeedingRecord> getFeedings() {
        return List.copyOf(feedings);
    }

    public List<GradeReport> getGradeReports() {
        return List.copyOf(gradeReports);
    }

    public List<HealthAssessment> getHealthAssessments() {
        return List.copyOf(healthAssessments);
    }

    public FeedingRecord lastFeeding() {
        return feedings.isEmpty() ? null : feedings.get(feedings.size() - 1);
    }

    public int ageOn(LocalDate date) {
        return Period.between(dateOfBirth, date).getYears();
    }

    private GradeReport gradeReport(String bulkUploadId) {
        return gradeReports.stream()
            .filter(r -> Objects.equals(r.bulkUploadId(), bulkUploadId))
            .findFirst()
            .orElse(null);
    }

    private HealthAssessment healthAssessment(String bulkUploadId) {
        return healthAssessments.stream()
            .filter(h -> Objects.equals(h.bulkUploadId(), bulkUploadId))
            .findFirst()
            .orElse(null);
    }

    private static void requireName(String firstName, String lastName) {
        if (firstName == null || firstName.isBlank() || lastName == null || lastName.isBlank()) {
            throw new CommandValidationException("first and last name are required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
