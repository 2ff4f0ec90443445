package com.geevly.bulkupload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A problem found while validating an upload. Row 0 refers to the file or its metadata.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationError(int row, String field, String message) {

    public static ValidationError ofFile(String message) {
        return new ValidationError(0, null, message);
    }
}
