package com.geevly.bulkupload;

import com.geevly.bulkupload.processing.BulkUploadProcessor;
import com.geevly.bulkupload.processing.RecordTracker;
import com.geevly.eventsourcing.NotFoundException;
import com.geevly.eventsourcing.UnsupportedCommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives an upload through validation, processing and undo, delegating the domain work to the
 * {@link BulkUploadProcessor} registered for its target domain.
 *
 * <p>Undo only reverses records whose latest action is processed, so it can be retried after an
 * {@link BulkUploadStatus#INVALIDATION_FAILED} without touching records that were already reversed.
 */
@Service
public class BulkUploadWorkflow {

    private static final Logger log = LoggerFactory.getLogger(BulkUploadWorkflow.class);

    private final BulkUploadService uploads;
    private final Map<TargetDomain, BulkUploadProcessor> processors = new EnumMap<>(TargetDomain.class);

    public BulkUploadWorkflow(BulkUploadService uploads, List<BulkUploadProcessor> processors) {
        this.uploads = uploads;
        for (BulkUploadProcessor processor : processors) {
            BulkUploadProcessor previous = this.processors.putIfAbsent(processor.targetDomain(), processor);
            if (previous != null) {
                throw new IllegalStateException("two processors for target domain " + processor.targetDomain().getValue());
            }
        }
    }

    public BulkUploadAggregate validate(String id) {
        BulkUploadAggregate upload = uploads.get(id);
        BulkUploadProcessor processor = processorFor(upload);
        upload = uploads.setStatus(id, BulkUploadStatus.VALIDATING);

        List<ValidationError> errors;
        try {
            errors = processor.validate(upload, uploads.fileContent(upload));
        } catch (RuntimeException ex) {
            log.warn("Validation of bulk upload id={} failed: {}", id, ex.getMessage());
            errors = List.of(ValidationError.ofFile(ex.getMessage()));
        }
        if (errors.isEmpty()) {
            return uploads.setStatus(id, BulkUploadStatus.VALIDATED);
        }
        return uploads.addValidationErrors(id, errors);
    }

    public BulkUploadAggregate process(String id) {
        BulkUploadAggregate upload = uploads.get(id);
        BulkUploadProcessor processor = processorFor(upload);
        upload = uploads.setStatus(id, BulkUploadStatus.PROCESSING);

        RecordTracker tracker = new RecordTracker(uploads, id, processor.recordType());
        try {
            processor.process(upload, uploads.fileContent(upload), tracker);
            tracker.flush();
        } catch (RuntimeException ex) {
            log.warn("Processing of bulk upload id={} failed after {} records: {}", id, tracker.processedCount(),
                ex.getMessage());
            try {
                tracker.flush();
                uploads.setStatus(id, BulkUploadStatus.ERROR);
            } catch (RuntimeException recordFailure) {
                ex.addSuppressed(recordFailure);
            }
            throw ex;
        }
        log.info("Processed bulk upload id={} records={}", id, tracker.processedCount());
        return uploads.setStatus(id, BulkUploadStatus.COMPLETED);
    }

    /**
     * Reverses every processed record of the upload. Records that are already gone downstream count
     * as reversed. Any other failure leaves the upload {@link BulkUploadStatus#INVALIDATION_FAILED}
     * with the records reversed so far marked, and is rethrown.
     */
    public BulkUploadAggregate undo(String id) {
        BulkUploadAggregate upload = uploads.get(id);
        if (upload.getStatus() == BulkUploadStatus.INVALIDATED) {
            log.info("Bulk upload id={} is already invalidated", id);
            return upload;
        }
        BulkUploadProcessor processor = processorFor(upload);
        if (upload.getStatus() != BulkUploadStatus.INVALIDATING) {
            upload = uploads.setStatus(id, BulkUploadStatus.INVALIDATING);
        }

        List<TrackedRecord> reversed = new ArrayList<>();
        try {
            for (TrackedRecord record : upload.recordsToUndo()) {
                try {
                    processor.reverse(upload, record.recordId());
                } catch (NotFoundException ex) {
                    log.warn("Record {} of bulk upload id={} is already gone: {}", record.recordId(), id, ex.getMessage());
                }
                reversed.add(record);
            }
        } catch (RuntimeException ex) {
            log.warn("Undo of bulk upload id={} failed after {} records: {}", id, reversed.size(), ex.getMessage());
            try {
                markInvalidated(id, reversed);
                uploads.setStatus(id, BulkUploadStatus.INVALIDATION_FAILED);
            } catch (RuntimeException recordFailure) {
                ex.addSuppressed(recordFailure);
            }
            throw ex;
        }
        markInvalidated(id, reversed);
        log.info("Invalidated bulk upload id={} records={}", id, reversed.size());
        return uploads.setStatus(id, BulkUploadStatus.INVALIDATED);
    }

    private void markInvalidated(String id, List<TrackedRecord> records) {
        Map<RecordType, List<String>> byType = new LinkedHashMap<>();
        for (TrackedRecord record : records) {
            byType.computeIfAbsent(record.type(), t -> new ArrayList<>()).add(record.recordId());
        }
        byType.forEach((type, ids) -> uploads.markRecordsInvalidated(id, ids, type));
    }

    private BulkUploadProcessor processorFor(BulkUploadAggregate upload) {
        BulkUploadProcessor processor = processors.get(upload.getTargetDomain());
        if (processor == null) {
            throw new UnsupportedCommandException("no processor for target domain " + upload.getTargetDomain().getValue());
        }
        return processor;
    }
}
