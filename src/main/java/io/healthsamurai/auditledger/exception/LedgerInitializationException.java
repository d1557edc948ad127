package io.healthsamurai.auditledger.exception;

/**
 * Thrown when the ledger cannot read its baseline (last sequence number and hash) from durable
 * storage. The ledger accepts no events until an initialization attempt succeeds.
 */
public class LedgerInitializationException extends RuntimeException {

    public LedgerInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
