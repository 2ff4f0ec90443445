package com.geevly.bulkupload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a bulk upload. Validation and processing run forwards; invalidation undoes a
 * processed batch and may be retried after it fails.
 */
public enum BulkUploadStatus {
    UNKNOWN("unknown"),
    PENDING("pending"),
    VALIDATING("validating"),
    VALIDATED("validated"),
    VALIDATION_FAILED("validation_failed"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    ERROR("error"),
    INVALIDATING("invalidating"),
    INVALIDATED("invalidated"),
    INVALIDATION_FAILED("invalidation_failed");

    private final String value;

    BulkUploadStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Set<BulkUploadStatus> successors() {
        switch (this) {
            case UNKNOWN:
                return EnumSet.of(PENDING);
            case PENDING:
                return EnumSet.of(VALIDATING);
            case VALIDATING:
                return EnumSet.of(VALIDATED, VALIDATION_FAILED);
            case VALIDATED:
                return EnumSet.of(PROCESSING);
            case PROCESSING:
                return EnumSet.of(COMPLETED, ERROR);
            case COMPLETED:
            case ERROR:
            case INVALIDATION_FAILED:
                return EnumSet.of(INVALIDATING);
            case INVALIDATING:
                return EnumSet.of(INVALIDATED, INVALIDATION_FAILED);
            default:
                return EnumSet.noneOf(BulkUploadStatus.class);
        }
    }

    public boolean canMoveTo(BulkUploadStatus next) {
        return successors().contains(next);
    }

    @JsonCreator
    public static BulkUploadStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown bulk upload status: " + raw));
    }
}
