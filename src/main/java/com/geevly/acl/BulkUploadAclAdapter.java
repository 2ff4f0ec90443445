package com.geevly.acl;

import com.geevly.bulkupload.BulkUploadAntiCorruptionLayer;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.NotFoundException;
import com.geevly.file.FileService;
import org.springframework.stereotype.Component;

@Component
public class BulkUploadAclAdapter implements BulkUploadAntiCorruptionLayer {

    private final FileService files;

    public BulkUploadAclAdapter(FileService files) {
        this.files = files;
    }

    @Override
    public void validateFileId(String fileId) {
        try {
            files.validateFileId(fileId);
        } catch (NotFoundException ex) {
            throw new CommandValidationException("unknown file " + fileId);
        }
    }

    @Override
    public byte[] fileContent(String fileId) {
        return files.content(fileId);
    }
}
