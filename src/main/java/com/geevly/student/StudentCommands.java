package com.geevly.student;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Commands accepted by {@link StudentAggregate}. Commands issued from a form carry the version
 * the caller last saw; bulk-upload commands act on whatever version is current.
 */
public final class StudentCommands {

    private StudentCommands() {
    }

    public record CreateStudent(String firstName, String lastName, LocalDate dateOfBirth, Sex sex,
                                int gradeLevel, String studentSchoolId, String bulkUploadId) {

        public CreateStudent(String firstName, String lastName, LocalDate dateOfBirth, Sex sex,
                             int gradeLevel, String studentSchoolId) {
            this(firstName, lastName, dateOfBirth, sex, gradeLevel, studentSchoolId, null);
        }
    }

    public record SetStatus(long expectedVersion, StudentStatus status) {}

    public record UpdateStudent(long expectedVersion, String firstName, String lastName, LocalDate dateOfBirth,
                                Sex sex, int gradeLevel, String studentSchoolId) {}

    public record Enroll(long expectedVersion, String schoolId, LocalDate dateOfEnrollment) {}

    public record Unenroll(long expectedVersion) {}

    public record SetLookupCode(long expectedVersion, String code) {}

    public record SetProfilePhoto(long expectedVersion, String fileId) {}

    public record Feed(long expectedVersion, Instant timestamp, String fileId) {}

    public record SetEligibility(long expectedVersion, boolean eligible) {}

    public record UpdateSponsorship(long expectedVersion, String sponsorId, LocalDate startDate, LocalDate endDate) {}

    public record AddGradeReport(int grade, LocalDate testDate, String bulkUploadId, String schoolYear,
                                 int gradingPeriod) {}

    public record AddHealthAssessment(LocalDate assessmentDate, String bulkUploadId, double heightCm,
                                      double weightKg) {}
}
