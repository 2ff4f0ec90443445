package com.geevly.student;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Payloads of the student stream, one record per {@link StudentEventType}.
 */
public final class StudentEvents {

    private StudentEvents() {
    }

    public record Created(String firstName, String lastName, LocalDate dateOfBirth, Sex sex,
                          int gradeLevel, String studentSchoolId, String bulkUploadId) {}

    public record StatusSet(StudentStatus status) {}

    public record Updated(String firstName, String lastName, LocalDate dateOfBirth, Sex sex,
                          int gradeLevel, String studentSchoolId) {}

    public record Enrolled(String schoolId, LocalDate dateOfEnrollment) {}

    public record Unenrolled(String schoolId) {}

    public record LookupCodeSet(String code) {}

    public record ProfilePhotoSet(String fileId) {}

    public record Fed(Instant timestamp, String fileId, String schoolId) {}

    public record EligibilitySet(boolean eligible) {}

    public record SponsorshipUpdated(String sponsorId, LocalDate startDate, LocalDate endDate) {}

    public record GradeReportAdded(int grade, LocalDate testDate, String bulkUploadId,
                                   String schoolYear, int gradingPeriod) {}

    public record GradeReportRemoved(String bulkUploadId) {}

    public record HealthAssessmentAdded(LocalDate assessmentDate, String bulkUploadId,
                                        double heightCm, double weightKg) {}

    public record HealthAssessmentRemoved(String bulkUploadId) {}

    public record CreationUndone(String bulkUploadId) {}
}
