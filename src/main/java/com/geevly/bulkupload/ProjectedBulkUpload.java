package com.geevly.bulkupload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectedBulkUpload(String id,
                                  BulkUploadStatus status,
                                  TargetDomain targetDomain,
                                  String fileId,
                                  Instant initiatedAt,
                                  Instant completedAt,
                                  Instant invalidationStartedAt,
                                  Instant invalidationCompletedAt,
                                  int totalRecords,
                                  int processedRecords,
                                  int invalidatedRecords,
                                  Map<String, String> uploadMetadata,
                                  List<ValidationError> validationErrors,
                                  long version) {}
