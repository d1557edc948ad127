package io.healthsamurai.auditledger.retention;

import io.healthsamurai.auditledger.model.EventType;
import io.healthsamurai.auditledger.model.Sensitivity;
import java.util.Set;

/**
 * One retention tier. Empty sets match everything; {@code days} of
 * {@link RetentionPolicyResolver#INDEFINITE} keeps records forever.
 */
public record RetentionRule(String name, Set<Sensitivity> sensitivities, Set<EventType> eventTypes, int days) {

    public RetentionRule {
        sensitivities = sensitivities == null ? Set.of() : Set.copyOf(sensitivities);
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    public boolean matches(Sensitivity sensitivity, EventType eventType) {
        return (sensitivities.isEmpty() || sensitivities.contains(sensitivity))
                && (eventTypes.isEmpty() || eventTypes.contains(eventType));
    }
}
