package com.geevly.bulkupload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CreateBulkUpload(TargetDomain targetDomain, String fileId, Map<String, String> uploadMetadata) {

    public CreateBulkUpload {
        Map<String, String> cleaned = new LinkedHashMap<>();
        if (uploadMetadata != null) {
            uploadMetadata.forEach((key, value) -> {
                if (key != null && value != null && !value.isBlank()) {
                    cleaned.put(key.trim(), value.trim());
                }
            });
        }
        uploadMetadata = Collections.unmodifiableMap(cleaned);
    }
}
