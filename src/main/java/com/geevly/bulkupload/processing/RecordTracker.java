package com.geevly.bulkupload.processing;

import com.geevly.bulkupload.BulkUploadService;
import com.geevly.bulkupload.RecordType;

import java.util.ArrayList;
import java.util.List;

/**
 * Records what a processor touches on the upload itself. Queued ids are written at once so a
 * crash can never leave an unqueued record behind; processed ids are written in batches.
 */
public class RecordTracker {

    static final int BATCH_SIZE = 100;

    private final BulkUploadService uploads;
    private final String uploadId;
    private final RecordType type;
    private final List<String> processed = new ArrayList<>();
    private int processedCount;

    public RecordTracker(BulkUploadService uploads, String uploadId, RecordType type) {
        this.uploads = uploads;
        this.uploadId = uploadId;
        this.type = type;
    }

    public void pending(List<String> recordIds) {
        if (!recordIds.isEmpty()) {
            uploads.addRecordsToProcess(uploadId, recordIds, type);
        }
    }

    public void processed(String recordId) {
        processed.add(recordId);
        processedCount++;
        if (processed.size() >= BATCH_SIZE) {
            flush();
        }
    }

    public void flush() {
        if (processed.isEmpty()) {
            return;
        }
        List<String> batch = List.copyOf(processed);
        uploads.markRecordsProcessed(uploadId, batch, type);
        processed.clear();
    }

    public int processedCount() {
        return processedCount;
    }
}
