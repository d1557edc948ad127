package io.healthsamurai.auditledger.model;

/**
 * Category of an audited event.
 */
public enum EventType {
    DATA_ACCESS,
    DATA_MODIFICATION,
    AUTH_EVENT,
    ADMIN_ACTION,
    PERMISSION_CHANGE,
    SECURITY_EVENT,
    SYSTEM_EVENT,
    COMPLIANCE_EVENT
}
