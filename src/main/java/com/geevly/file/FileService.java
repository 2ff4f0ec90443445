package com.geevly.file;

import com.geevly.config.GeevlyProperties;
import com.geevly.eventsourcing.AggregateNotFoundException;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.Event;
import com.geevly.eventsourcing.EventSourcedService;
import com.geevly.eventsourcing.NotFoundException;
import com.geevly.file.FileCommands.CreateFile;
import com.geevly.file.FileCommands.DeleteFile;
import com.geevly.projection.PagedResult;
import com.geevly.projection.Paging;
import com.geevly.projection.ProjectionDispatcher;
import com.geevly.projection.RefreshMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class FileService extends EventSourcedService<FileAggregate> {

    private static final Logger log = LoggerFactory.getLogger(FileService.class);

    private final FileRepository files;
    private final FileStorage storage;
    private final int maxPageSize;

    public FileService(FileRepository files,
                       ProjectionDispatcher dispatcher,
                       FileStorage storage,
                       GeevlyProperties properties) {
        super(files, dispatcher);
        this.files = files;
        this.storage = storage;
        this.maxPageSize = properties.paging().maxPageSize();
    }

    /**
     * Stores the bytes, then records the file. The projection is refreshed before returning so the
     * new id passes {@link #validateFileId} straight away.
     */
    public FileAggregate createFile(CreateFile cmd, byte[] content) {
        String id = UUID.randomUUID().toString();
        FileAggregate file = files.newAggregate(id);
        Event created = file.create(cmd, content == null ? 0 : content.length);
        storage.store(file.getDomainReference(), id, content);
        try {
            files.save(id, List.of(created));
        } catch (RuntimeException ex) {
            storage.delete(file.getDomainReference(), id);
            throw ex;
        }
        dispatcher.publish(FileAggregate.STREAM, List.of(created), RefreshMode.SYNC);
        log.info("Stored file id={} domain={} size={}", id, file.getDomainReference(), file.getSize());
        return file;
    }

    public FileAggregate delete(String id, DeleteFile cmd) {
        FileAggregate file = execute(id, f -> f.delete(cmd), RefreshMode.SYNC);
        storage.delete(file.getDomainReference(), id);
        return file;
    }

    public byte[] content(String id) {
        FileAggregate file = get(id);
        if (file.isDeleted()) {
            throw new NotFoundException("file " + id + " has been deleted");
        }
        return storage.retrieve(file.getDomainReference(), id);
    }

    public ProjectedFile getProjected(String id) {
        return files.findProjected(id).orElseThrow(() -> new AggregateNotFoundException(FileAggregate.STREAM, id));
    }

    public PagedResult<ProjectedFile> listByDomain(String domainReference, Integer limit, Integer page) {
        return files.listByDomain(domainReference, Paging.of(limit, page, maxPageSize));
    }

    /**
     * Passes when the file exists and has not been deleted.
     */
    public ProjectedFile validateFileId(String id) {
        ProjectedFile file = getProjected(id);
        if (file.deleted()) {
            throw new CommandValidationException("file " + id + " has been deleted");
        }
        return file;
    }

    public void validatePhotoId(String id) {
        ProjectedFile file = validateFileId(id);
        if (file.mimeType() == null || !file.mimeType().startsWith("image/")) {
            throw new CommandValidationException("file " + id + " is not an image");
        }
    }
}
