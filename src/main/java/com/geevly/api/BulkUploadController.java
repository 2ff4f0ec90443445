package com.geevly.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.geevly.bulkupload.BulkUploadAggregate;
import com.geevly.bulkupload.BulkUploadService;
import com.geevly.bulkupload.BulkUploadWorkflow;
import com.geevly.bulkupload.CreateBulkUpload;
import com.geevly.bulkupload.ProjectedBulkUpload;
import com.geevly.bulkupload.TargetDomain;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.projection.PagedResult;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bulk uploads. The workflow steps run on the request thread and answer with the refreshed
 * projection.
 */
@RestController
@RequestMapping("/api/v1/bulk-uploads")
public class BulkUploadController {

    private final BulkUploadService uploads;
    private final BulkUploadWorkflow workflow;
    private final PayloadCodec codec;

    public BulkUploadController(BulkUploadService uploads, BulkUploadWorkflow workflow, PayloadCodec codec) {
        this.uploads = uploads;
        this.workflow = workflow;
        this.codec = codec;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectedBulkUpload create(@RequestBody BulkUploadRequest request) {
        BulkUploadAggregate upload = uploads.create(
            new CreateBulkUpload(request.targetDomain(), request.fileId(), request.uploadMetadata()));
        return uploads.getProjected(upload.getId());
    }

    @GetMapping
    public PagedResult<ProjectedBulkUpload> list(@RequestParam(name = "target_domain", required = false) String targetDomain,
                                                 @RequestParam(required = false) Integer limit,
                                                 @RequestParam(required = false) Integer page) {
        return uploads.list(Optional.ofNullable(TargetDomain.fromValue(targetDomain)), limit, page);
    }

    @GetMapping("/{id}")
    public ProjectedBulkUpload get(@PathVariable String id) {
        return uploads.getProjected(id);
    }

    @GetMapping("/{id}/history")
    public List<EventView> history(@PathVariable String id) {
        return uploads.history(id).stream().map(e -> EventView.of(e, codec)).toList();
    }

    @PostMapping("/{id}/validate")
    public ProjectedBulkUpload validate(@PathVariable String id) {
        workflow.validate(id);
        return uploads.getProjected(id);
    }

    @PostMapping("/{id}/process")
    public ProjectedBulkUpload process(@PathVariable String id) {
        workflow.process(id);
        return uploads.getProjected(id);
    }

    @PostMapping("/{id}/undo")
    public ProjectedBulkUpload undo(@PathVariable String id) {
        workflow.undo(id);
        return uploads.getProjected(id);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record BulkUploadRequest(TargetDomain targetDomain, String fileId, Map<String, String> uploadMetadata) {}
}
