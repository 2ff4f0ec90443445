package com.geevly.bulkupload;

import java.time.Instant;

public record StatusChange(BulkUploadStatus status, Instant at) {}
