package io.healthsamurai.auditledger.model;

/**
 * Verb describing what the actor did.
 */
public enum AuditAction {
    // Authentication
    LOGIN_SUCCESS,
    LOGIN_FAILURE,
    LOGOUT,
    PASSWORD_CHANGE,
    MFA_CHALLENGE,
    SESSION_EXPIRED,

    // Data
    CREATE,
    READ,
    UPDATE,
    DELETE,
    EXPORT,
    IMPORT,

    // Authorization
    ACCESS_DENIED,
    PERMISSION_GRANTED,
    PERMISSION_REVOKED,
    ROLE_ASSIGNED,
    ROLE_REMOVED,

    // Administration and system
    CONFIG_CHANGE,
    USER_CREATED,
    USER_DISABLED,
    SYSTEM_START,
    SYSTEM_SHUTDOWN,

    // Security and compliance
    SUSPICIOUS_ACTIVITY,
    POLICY_VIOLATION,
    AUDIT_REVIEW,
    REPORT_GENERATED
}
