package io.healthsamurai.auditledger.exception;

/**
 * Thrown when an event lacks the identity or resource fields a record needs.
 * Raised before any sequence number is taken.
 */
public class InvalidAuditEventException extends RuntimeException {

    public InvalidAuditEventException(String message) {
        super(message);
    }
}
