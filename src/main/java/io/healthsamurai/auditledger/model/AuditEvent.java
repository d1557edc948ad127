package io.healthsamurai.auditledger.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * An audit-worthy action submitted by a caller, before it has been placed in the ledger.
 */
@Getter
@Builder(toBuilder = true)
public class AuditEvent {

    private final EventType eventType;

    private final AuditAction action;

    /** Identifier of the actor, as supplied by the identity provider */
    private final String userId;

    /** Role names held by the actor when the event happened */
    @Singular
    private final Set<String> userRoles;

    /** Kind of thing acted on (e.g., vehicle, work-order, user) */
    private final String resource;

    private final String resourceId;

    /** When the action happened; the ledger uses its own clock if absent */
    private final Instant timestamp;

    private final String ipAddress;

    private final String userAgent;

    private final AuditResult result;

    private final Sensitivity sensitivity;

    /** Free-form key/value context, hashed with stable key ordering */
    @Singular("detail")
    private final Map<String, Object> details;

    private final String sessionId;

    private final GeoLocation geoLocation;
}
