package com.geevly.api;

import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.file.FileAggregate;
import com.geevly.file.FileCommands.CreateFile;
import com.geevly.file.FileCommands.DeleteFile;
import com.geevly.file.FileService;
import com.geevly.file.ProjectedFile;
import com.geevly.projection.PagedResult;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/files")
public class FileController {

    private final FileService files;
    private final PayloadCodec codec;

    public FileController(FileService files, PayloadCodec codec) {
        this.files = files;
        this.codec = codec;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> upload(@RequestPart("file") MultipartFile file,
                                      @RequestParam("domain_reference") String domainReference,
                                      @RequestParam(name = "bulk_upload_id", required = false) String bulkUploadId)
            throws IOException {
        CreateFile cmd = new CreateFile(file.getOriginalFilename(), domainReference, file.getContentType(), Map.of(),
            bulkUploadId);
        FileAggregate created = files.createFile(cmd, file.getBytes());
        return Map.of(
            "id", created.getId(),
            "version", created.getVersion(),
            "size", created.getSize()
        );
    }

    @GetMapping
    public PagedResult<ProjectedFile> list(@RequestParam("domain_reference") String domainReference,
                                           @RequestParam(required = false) Integer limit,
                                           @RequestParam(required = false) Integer page) {
        return files.listByDomain(domainReference, limit, page);
    }

    @GetMapping("/{id}")
    public ProjectedFile get(@PathVariable String id) {
        return files.getProjected(id);
    }

    @GetMapping("/{id}/history")
    public List<EventView> history(@PathVariable String id) {
        return files.history(id).stream().map(e -> EventView.of(e, codec)).toList();
    }

    @GetMapping("/{id}/content")
    public ResponseEntity<byte[]> content(@PathVariable String id) {
        FileAggregate file = files.get(id);
        byte[] content = files.content(id);
        MediaType type = file.getMimeType() == null
            ? MediaType.APPLICATION_OCTET_STREAM
            : MediaType.parseMediaType(file.getMimeType());
        return ResponseEntity.ok()
            .contentType(type)
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(file.getName()).build().toString())
            .body(content);
    }

    @DeleteMapping("/{id}")
    public CommandResult delete(@PathVariable String id, @RequestParam("expected_version") long expectedVersion) {
        return CommandResult.of(files.delete(id, new DeleteFile(expectedVersion)));
    }
}
