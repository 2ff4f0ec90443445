package com.geevly.student;

import com.geevly.eventsourcing.EventType;

import java.util.Arrays;
import java.util.Optional;

public enum StudentEventType implements EventType {
    CREATED("AddStudent", StudentEvents.Created.class),
    STATUS_SET("SetStudentStatus", StudentEvents.StatusSet.class),
    UPDATED("UpdateStudent", StudentEvents.Updated.class),
    ENROLLED("EnrollStudent", StudentEvents.Enrolled.class),
    UNENROLLED("UnenrollStudent", StudentEvents.Unenrolled.class),
    LOOKUP_CODE_SET("SetLookupCode", StudentEvents.LookupCodeSet.class),
    PROFILE_PHOTO_SET("SetProfilePhoto", StudentEvents.ProfilePhotoSet.class),
    FED("FeedStudent", StudentEvents.Fed.class),
    ELIGIBILITY_SET("SetEligibility", StudentEvents.EligibilitySet.class),
    SPONSORSHIP_UPDATED("UpdateSponsorship", StudentEvents.SponsorshipUpdated.class),
    GRADE_REPORT_ADDED("AddGradeReport", StudentEvents.GradeReportAdded.class),
    GRADE_REPORT_REMOVED("RemoveGradeReport", StudentEvents.GradeReportRemoved.class),
    HEALTH_ASSESSMENT_ADDED("AddHealthAssessment", StudentEvents.HealthAssessmentAdded.class),
    HEALTH_ASSESSMENT_REMOVED("RemoveHealthAssessment", StudentEvents.HealthAssessmentRemoved.class),
    CREATION_UNDONE("UndoCreateStudent", StudentEvents.CreationUndone.class);

    private final String value;
    private final Class<?> payloadType;

    StudentEventType(String value, Class<?> payloadType) {
        this.value = value;
        this.payloadType = payloadType;
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public Class<?> payloadType() {
        return payloadType;
    }

    public static Optional<StudentEventType> fromValue(String raw) {
        return Arrays.stream(values()).filter(v -> v.value.equals(raw)).findFirst();
    }
}
