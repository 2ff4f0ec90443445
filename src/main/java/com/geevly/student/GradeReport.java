package com.geevly.student;

import java.time.LocalDate;

public record GradeReport(int grade, LocalDate testDate, String bulkUploadId, String schoolYear, int gradingPeriod) {}
