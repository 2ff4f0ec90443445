package com.geevly.student;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Row of {@code student_projections}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectedStudent(
    String id,
    String firstName,
    String lastName,
    LocalDate dateOfBirth,
    Sex sex,
    StudentStatus status,
    String studentSchoolId,
    int gradeLevel,
    String schoolId,
    LocalDate dateOfEnrollment,
    String lookupCode,
    String profilePhotoId,
    boolean eligibleForSponsorship,
    Instant lastFeedingAt,
    int feedingCount,
    long version
) {}
