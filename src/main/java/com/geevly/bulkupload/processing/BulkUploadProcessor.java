package com.geevly.bulkupload.processing;

import com.geevly.bulkupload.BulkUploadAggregate;
import com.geevly.bulkupload.RecordType;
import com.geevly.bulkupload.TargetDomain;
import com.geevly.bulkupload.ValidationError;

import java.util.List;

/**
 * Applies one kind of upload file to its downstream domain and knows how to take it back.
 */
public interface BulkUploadProcessor {

    TargetDomain targetDomain();

    RecordType recordType();

    /**
     * Checks the file without writing anything. An empty result means the upload may be processed.
     */
    List<ValidationError> validate(BulkUploadAggregate upload, byte[] content);

    /**
     * Writes the file downstream, reporting every touched record to the tracker.
     */
    void process(BulkUploadAggregate upload, byte[] content, RecordTracker tracker);

    /**
     * Reverses what {@link #process} did to one record. Throws
     * {@link com.geevly.eventsourcing.NotFoundException} when there is nothing left to reverse.
     */
    void reverse(BulkUploadAggregate upload, String recordId);
}
