package io.healthsamurai.auditledger.storage;

import io.healthsamurai.auditledger.model.AuditAction;
import io.healthsamurai.auditledger.model.AuditEvent;
import io.healthsamurai.auditledger.model.AuditResult;
import io.healthsamurai.auditledger.model.EventType;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.model.Sensitivity;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Filter over stored records. Unset fields match everything; set fields must all match.
 * Results are ordered newest event first and paged with {@code offset} and {@code limit}.
 */
@Getter
@Builder(toBuilder = true)
public class AuditQuery {

    public static final int DEFAULT_LIMIT = 100;

    private final String userId;

    private final AuditAction action;

    private final EventType eventType;

    private final AuditResult result;

    private final Sensitivity sensitivity;

    private final String resource;

    private final String resourceId;

    /** Inclusive lower bound on the event timestamp */
    private final Instant from;

    /** Inclusive upper bound on the event timestamp */
    private final Instant to;

    @Builder.Default
    private final int limit = DEFAULT_LIMIT;

    @Builder.Default
    private final int offset = 0;

    public boolean matches(ImmutableAuditRecord record) {
        AuditEvent event = record.getEvent();
        if (userId != null && !userId.equals(event.getUserId())) {
            return false;
        }
        if (action != null && action != event.getAction()) {
            return false;
        }
        if (eventType != null && eventType != event.getEventType()) {
            return false;
        }
        if (result != null && result != event.getResult()) {
            return false;
        }
        if (sensitivity != null && sensitivity != event.getSensitivity()) {
            return false;
        }
        if (resource != null && !resource.equals(event.getResource())) {
            return false;
        }
        if (resourceId != null && !resourceId.equals(event.getResourceId())) {
            return false;
        }
        Instant timestamp = event.getTimestamp();
        if (from != null && (timestamp == null || timestamp.isBefore(from))) {
            return false;
        }
        return to == null || (timestamp != null && !timestamp.isAfter(to));
    }
}
