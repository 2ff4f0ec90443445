package com.geevly.student;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Feedings of one student at one school within a reporting window.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeedingHistoryEntry(String studentId, String firstName, String lastName, List<Instant> feedings) {}
