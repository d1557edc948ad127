package io.healthsamurai.auditledger.storage;

import io.healthsamurai.auditledger.exception.StorageException;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-once blob store on the local filesystem. Keys are relative paths below the root.
 */
public class FileSystemBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);

    private final Path root;

    public FileSystemBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void putIfAbsent(String key, byte[] content) throws StorageException {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.debug("Stored blob {} ({} bytes)", key, content.length);
        } catch (FileAlreadyExistsException e) {
            throw new StorageException("Blob " + key + " already exists and cannot be overwritten", e);
        } catch (IOException e) {
            throw new StorageException("Cannot write blob " + key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) throws StorageException {
        Path target = resolve(key);
        if (!Files.exists(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (IOException e) {
            throw new StorageException("Cannot read blob " + key, e);
        }
    }

    private Path resolve(String key) throws StorageException {
        if (key == null || key.isBlank()) {
            throw new StorageException("Blob key must not be empty");
        }
        Path target = root.resolve(key).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new StorageException("Blob key escapes the store root: " + key);
        }
        return target;
    }

    public Path getRoot() {
        return root;
    }
}
