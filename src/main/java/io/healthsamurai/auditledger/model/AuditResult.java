package io.healthsamurai.auditledger.model;

public enum AuditResult {
    SUCCESS,
    FAILURE,
    PARTIAL
}
