package com.geevly.bulkupload;

import com.geevly.eventsourcing.EventType;

import java.util.Arrays;
import java.util.Optional;

public enum BulkUploadEventType implements EventType {
    CREATED("CreateBulkUpload", BulkUploadEvents.Created.class),
    STATUS_SET("SetBulkUploadStatus", BulkUploadEvents.StatusSet.class),
    VALIDATION_ERRORS_ADDED("AddValidationErrors", BulkUploadEvents.ValidationErrorsAdded.class),
    RECORDS_ADDED("AddRecordsToProcess", BulkUploadEvents.RecordsTracked.class),
    RECORDS_PROCESSED("MarkRecordsAsProcessed", BulkUploadEvents.RecordsTracked.class),
    RECORDS_INVALIDATED("MarkRecordsAsInvalidated", BulkUploadEvents.RecordsTracked.class);

    private final String value;
    private final Class<?> payloadType;

    BulkUploadEventType(String value, Class<?> payloadType) {
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

    public static Optional<BulkUploadEventType> fromValue(String raw) {
        return Arrays.stream(values()).filter(v -> v.value.equals(raw)).findFirst();
    }
}
