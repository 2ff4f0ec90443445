package com.geevly.file;

/**
 * Byte storage behind the file domain, addressed by owning domain and file id.
 */
public interface FileStorage {

    void store(String domainReference, String fileId, byte[] content);

    byte[] retrieve(String domainReference, String fileId);

    void delete(String domainReference, String fileId);
}
