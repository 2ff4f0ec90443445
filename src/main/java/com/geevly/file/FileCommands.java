package com.geevly.file;

import java.util.Map;

public final class FileCommands {

    private FileCommands() {
    }

    public record CreateFile(String name, String domainReference, String mimeType, Map<String, String> metadata,
                             String associatedBulkUploadId) {

        public CreateFile(String name, String domainReference, String mimeType) {
            this(name, domainReference, mimeType, Map.of(), null);
        }
    }

    public record DeleteFile(long expectedVersion) {}
}
