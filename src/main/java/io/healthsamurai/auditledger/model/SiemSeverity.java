package io.healthsamurai.auditledger.model;

/**
 * Severity attached to records forwarded to the SIEM.
 */
public enum SiemSeverity {
    INFO,
    MEDIUM,
    HIGH,
    CRITICAL
}
