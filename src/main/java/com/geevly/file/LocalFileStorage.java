package com.geevly.file;

import com.geevly.config.GeevlyProperties;
import com.geevly.eventsourcing.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Stores files under {@code <root>/<domain>/<file id>}.
 */
@Component
public class LocalFileStorage implements FileStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalFileStorage.class);

    private final Path root;

    public LocalFileStorage(GeevlyProperties properties) {
        this.root = Paths.get(properties.files().root()).toAbsolutePath().normalize();
    }

    @Override
    public void store(String domainReference, String fileId, byte[] content) {
        Path target = resolve(domainReference, fileId);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), fileId, ".part");
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new FileStorageException("cannot store file " + fileId, ex);
        }
    }

    @Override
    public byte[] retrieve(String domainReference, String fileId) {
        try {
            return Files.readAllBytes(resolve(domainReference, fileId));
        } catch (NoSuchFileException ex) {
            throw new NotFoundException("no stored content for file " + fileId);
        } catch (IOException ex) {
            throw new FileStorageException("cannot read file " + fileId, ex);
        }
    }

    @Override
    public void delete(String domainReference, String fileId) {
        try {
            if (!Files.deleteIfExists(resolve(domainReference, fileId))) {
                log.warn("No stored content to delete for file={} domain={}", fileId, domainReference);
            }
        } catch (IOException ex) {
            throw new FileStorageException("cannot delete file " + fileId, ex);
        }
    }

    private Path resolve(String domainReference, String fileId) {
        Path path = root.resolve(domainReference).resolve(fileId).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("file path escapes storage root: " + domainReference + "/" + fileId);
        }
        return path;
    }
}
