package com.geevly.student;

import java.time.Instant;

/**
 * @param schoolId school the student was enrolled in when fed, null when not enrolled
 */
public record FeedingRecord(Instant timestamp, String fileId, String schoolId) {}
