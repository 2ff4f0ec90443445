package com.geevly.file;

import java.util.Map;

public final class FileEvents {

    private FileEvents() {
    }

    public record Created(String name, String domainReference, String mimeType, long size, String extension,
                          Map<String, String> metadata, String associatedBulkUploadId) {}

    public record Deleted(String domainReference) {}
}
