package io.healthsamurai.auditledger.storage;

import io.healthsamurai.auditledger.exception.StorageException;
import java.util.Optional;

/**
 * Write-once object storage.
 */
public interface BlobStore {

    /**
     * Stores content under a key that must not exist yet.
     *
     * @throws StorageException if the key already exists or the write fails
     */
    void putIfAbsent(String key, byte[] content) throws StorageException;

    Optional<byte[]> get(String key) throws StorageException;
}
