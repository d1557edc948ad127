package io.healthsamurai.auditledger.exception;

/**
 * Failure of a single storage backend to read or write.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
