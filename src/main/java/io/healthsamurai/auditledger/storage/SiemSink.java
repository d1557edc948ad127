package io.healthsamurai.auditledger.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.healthsamurai.auditledger.exception.StorageException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * SIEM ingestion endpoint.
 */
public interface SiemSink {

    /**
     * @param document The record enriched with severity and tags
     * @throws StorageException if the endpoint did not accept the document
     */
    void send(ObjectNode document) throws StorageException;

    /**
     * Sends without blocking the caller. The default runs {@link #send(ObjectNode)} on the given
     * executor; implementations with a non-blocking transport override it.
     *
     * @return A future that fails with a {@link StorageException} cause if the document was not accepted
     * @throws java.util.concurrent.RejectedExecutionException if the executor no longer accepts work
     */
    default CompletableFuture<Void> sendAsync(ObjectNode document, Executor executor) {
        return CompletableFuture.runAsync(() -> {
            try {
                send(document);
            } catch (StorageException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
