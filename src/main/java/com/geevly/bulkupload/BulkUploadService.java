package com.geevly.bulkupload;

import com.geevly.config.GeevlyProperties;
import com.geevly.eventsourcing.AggregateNotFoundException;
import com.geevly.eventsourcing.EventSourcedService;
import com.geevly.projection.PagedResult;
import com.geevly.projection.Paging;
import com.geevly.projection.ProjectionDispatcher;
import com.geevly.projection.RefreshMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bulk upload commands. Every write refreshes the projection synchronously because the upload
 * page polls it while the workflow runs.
 */
@Service
public class BulkUploadService extends EventSourcedService<BulkUploadAggregate> {

    private static final Logger log = LoggerFactory.getLogger(BulkUploadService.class);

    private final BulkUploadRepository uploads;
    private final BulkUploadAntiCorruptionLayer acl;
    private final Clock clock;
    private final int maxPageSize;

    public BulkUploadService(BulkUploadRepository uploads,
                             ProjectionDispatcher dispatcher,
                             BulkUploadAntiCorruptionLayer acl,
                             Clock clock,
                             GeevlyProperties properties) {
        super(uploads, dispatcher);
        this.uploads = uploads;
        this.acl = acl;
        this.clock = clock;
        this.maxPageSize = properties.paging().maxPageSize();
    }

    public BulkUploadAggregate create(CreateBulkUpload cmd) {
        String id = UUID.randomUUID().toString();
        BulkUploadAggregate upload = create(id,
            u -> u.create(cmd, clock.instant(), LocalDate.now(clock), acl), RefreshMode.SYNC);
        log.info("Created bulk upload id={} target={} file={}", id, upload.getTargetDomain().getValue(),
            upload.getFileId());
        return upload;
    }

    public BulkUploadAggregate setStatus(String id, BulkUploadStatus status) {
        BulkUploadAggregate upload = execute(id, u -> u.setStatus(status, clock.instant()), RefreshMode.SYNC);
        log.info("Bulk upload id={} is now {}", id, status.getValue());
        return upload;
    }

    public BulkUploadAggregate addValidationErrors(String id, List<ValidationError> errors) {
        BulkUploadAggregate upload = execute(id, u -> u.addValidationErrors(errors, clock.instant()), RefreshMode.SYNC);
        log.info("Bulk upload id={} failed validation with {} errors", id, errors.size());
        return upload;
    }

    public BulkUploadAggregate addRecordsToProcess(String id, List<String> recordIds, RecordType type) {
        return execute(id, u -> u.addRecordsToProcess(recordIds, type, clock.instant()), RefreshMode.SYNC);
    }

    public BulkUploadAggregate markRecordsProcessed(String id, List<String> recordIds, RecordType type) {
        return execute(id, u -> u.markRecordsProcessed(recordIds, type, clock.instant()), RefreshMode.SYNC);
    }

    public BulkUploadAggregate markRecordsInvalidated(String id, List<String> recordIds, RecordType type) {
        return execute(id, u -> u.markRecordsInvalidated(recordIds, type, clock.instant()), RefreshMode.SYNC);
    }

    public byte[] fileContent(BulkUploadAggregate upload) {
        return acl.fileContent(upload.getFileId());
    }

    public ProjectedBulkUpload getProjected(String id) {
        return uploads.findProjected(id)
            .orElseThrow(() -> new AggregateNotFoundException(BulkUploadAggregate.STREAM, id));
    }

    public PagedResult<ProjectedBulkUpload> list(Optional<TargetDomain> targetDomain, Integer limit, Integer page) {
        return uploads.list(targetDomain, Paging.of(limit, page, maxPageSize));
    }
}
