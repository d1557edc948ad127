package io.healthsamurai.auditledger.model;

/**
 * Classification of how protected the underlying data or action is, lowest first.
 */
public enum Sensitivity {
    PUBLIC,
    INTERNAL,
    CONFIDENTIAL,
    RESTRICTED
}
