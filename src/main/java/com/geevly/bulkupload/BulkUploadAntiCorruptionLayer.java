package com.geevly.bulkupload;

/**
 * File access for bulk uploads.
 */
public interface BulkUploadAntiCorruptionLayer {

    void validateFileId(String fileId);

    byte[] fileContent(String fileId);
}
