package com.geevly.file;

import com.geevly.eventsourcing.AggregateRoot;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.Event;
import com.geevly.eventsourcing.EventRouter;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.file.FileCommands.CreateFile;
import com.geevly.file.FileCommands.DeleteFile;
import com.geevly.file.FileEvents.Created;
import com.geevly.file.FileEvents.Deleted;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;

public class FileAggregate extends AggregateRoot<FileAggregate> {

    public static final String STREAM = "file";

    private static final EventRouter<FileAggregate> ROUTER = EventRouter
        .<FileAggregate, FileEventType>builder(STREAM, FileEventType.class)
        .creation(FileEventType.CREATED, Created.class, (f, p, e) -> {
            f.created = true;
            f.name = p.name();
            f.domainReference = p.domainReference();
            f.mimeType = p.mimeType();
            f.size = p.size();
            f.extension = p.extension();
            f.metadata = p.metadata() == null ? Map.of() : Map.copyOf(p.metadata());
            f.associatedBulkUploadId = p.associatedBulkUploadId();
        })
        .on(FileEventType.DELETED, Deleted.class, (f, p, e) -> f.deleted = true)
        .build();

    private boolean created;
    private boolean deleted;
    private String name;
    private String domainReference;
    private String mimeType;
    private long size;
    private String extension;
    private Map<String, String> metadata = Map.of();
    private String associatedBulkUploadId;

    public FileAggregate(String id, PayloadCodec codec) {
        super(id, codec);
    }

    public FileAggregate(String id, PayloadCodec codec, Clock clock) {
        super(id, codec, clock);
    }

    @Override
    protected EventRouter<FileAggregate> router() {
        return ROUTER;
    }

    @Override
    protected FileAggregate self() {
        return this;
    }

    @Override
    public boolean exists() {
        return created;
    }

    public Event create(CreateFile cmd, long size) {
        requireCreatable();
        if (cmd.name() == null || cmd.name().isBlank()) {
            throw new CommandValidationException("file name is required");
        }
        if (cmd.domainReference() == null || cmd.domainReference().isBlank()) {
            throw new CommandValidationException("domain reference is required");
        }
        if (size <= 0) {
            throw new CommandValidationException("file is empty");
        }
        String fileName = cmd.name().trim();
        return raise(FileEventType.CREATED, new Created(fileName, cmd.domainReference(),
            cmd.mimeType() == null || cmd.mimeType().isBlank() ? "application/octet-stream" : cmd.mimeType(),
            size, extensionOf(fileName), cmd.metadata() == null ? Map.of() : cmd.metadata(),
            cmd.associatedBulkUploadId()));
    }

    public Event delete(DeleteFile cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        if (deleted) {
            throw new CommandValidationException("file " + getId() + " is already deleted");
        }
        return raise(FileEventType.DELETED, new Deleted(domainReference));
    }

    public boolean isDeleted() {
        return deleted;
    }

    public String getName() {
        return name;
    }

    public String getDomainReference() {
        return domainReference;
    }

    public String getMimeType() {
        return mimeType;
    }

    public long getSize() {
        return size;
    }

    public String getExtension() {
        return extension;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public String getAssociatedBulkUploadId() {
        return associatedBulkUploadId;
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 || dot == fileName.length() - 1 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
