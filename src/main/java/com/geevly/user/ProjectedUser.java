package com.geevly.user;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectedUser(String id, String firstName, String lastName, String email, boolean active,
                            List<String> roles, Instant passwordChangedAt, long version) {}
