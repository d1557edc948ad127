package io.healthsamurai.auditledger.builder;

import io.healthsamurai.auditledger.exception.InvalidAuditEventException;
import io.healthsamurai.auditledger.model.AuditEvent;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks that an event carries what a record needs and puts it in the form that gets hashed.
 */
public class AuditEventValidator {

    /**
     * Validates an event and returns the copy that will be recorded: missing timestamp replaced
     * by {@code now}, details converted to plain JSON values.
     *
     * @param event The submitted event
     * @param now Ledger clock reading used when the event has no timestamp
     * @return The normalized event
     * @throws InvalidAuditEventException if required fields are missing or details are not JSON
     */
    public AuditEvent validate(AuditEvent event, Instant now) {
        if (event == null) {
            throw new InvalidAuditEventException("Audit event must not be null");
        }

        List<String> missing = new ArrayList<>();
        if (isBlank(event.getUserId())) missing.add("userId");
        if (isBlank(event.getResource())) missing.add("resource");
        if (isBlank(event.getResourceId())) missing.add("resourceId");
        if (event.getEventType() == null) missing.add("eventType");
        if (event.getAction() == null) missing.add("action");
        if (event.getResult() == null) missing.add("result");
        if (event.getSensitivity() == null) missing.add("sensitivity");

        if (!missing.isEmpty()) {
            throw new InvalidAuditEventException("Audit event is missing required fields: " + String.join(", ", missing));
        }

        Map<String, Object> details;
        try {
            details = event.getDetails() == null ? Map.of() : JsonUtil.toJsonMap(event.getDetails());
        } catch (IllegalArgumentException e) {
            throw new InvalidAuditEventException("Audit event details are not JSON-serializable: " + e.getMessage());
        }

        return event.toBuilder()
                .timestamp(event.getTimestamp() != null ? event.getTimestamp() : now)
                .clearDetails()
                .details(details)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
