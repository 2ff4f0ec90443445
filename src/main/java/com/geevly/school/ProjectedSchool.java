package com.geevly.school;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectedSchool(String id, String name, String principal, String contactNumber, boolean active,
                              long version, Instant updatedAt) {}
