package com.geevly.bulkupload;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class BulkUploadEvents {

    private BulkUploadEvents() {
    }

    public record Created(TargetDomain targetDomain, String fileId, Map<String, String> uploadMetadata,
                          Instant initiatedAt) {}

    public record StatusSet(BulkUploadStatus status, Instant at) {}

    public record ValidationErrorsAdded(List<ValidationError> errors, Instant at) {}

    /**
     * Shared by the three record-tracking events; the event type decides the action recorded.
     */
    public record RecordsTracked(List<String> recordIds, RecordType recordType, Instant at) {}
}
