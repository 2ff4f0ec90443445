package com.geevly.file;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectedFile(String id, String domainReference, String name, String mimeType, long size,
                            boolean deleted, long version) {}
