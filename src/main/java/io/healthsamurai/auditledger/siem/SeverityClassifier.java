package io.healthsamurai.auditledger.siem;

import io.healthsamurai.auditledger.model.AuditEvent;
import io.healthsamurai.auditledger.model.AuditResult;
import io.healthsamurai.auditledger.model.EventType;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.model.Sensitivity;
import io.healthsamurai.auditledger.model.SiemSeverity;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Derives the SIEM severity and search tags of a record.
 */
public class SeverityClassifier {

    /**
     * Rules in priority order: security events are critical; restricted data and failed
     * authentication are high; admin actions are medium; anything else is informational.
     */
    public SiemSeverity classify(ImmutableAuditRecord record) {
        AuditEvent event = record.getEvent();

        if (event.getEventType() == EventType.SECURITY_EVENT) {
            return SiemSeverity.CRITICAL;
        }
        if (event.getSensitivity() == Sensitivity.RESTRICTED) {
            return SiemSeverity.HIGH;
        }
        if (event.getEventType() == EventType.AUTH_EVENT && event.getResult() == AuditResult.FAILURE) {
            return SiemSeverity.HIGH;
        }
        if (event.getEventType() == EventType.ADMIN_ACTION) {
            return SiemSeverity.MEDIUM;
        }
        return SiemSeverity.INFO;
    }

    /**
     * @return {@code event:}, {@code action:}, {@code result:} and {@code sensitivity:} tags, then
     *         one {@code role:} tag per role in alphabetical order
     */
    public List<String> tags(ImmutableAuditRecord record) {
        AuditEvent event = record.getEvent();
        List<String> tags = new ArrayList<>();
        tags.add("event:" + event.getEventType());
        tags.add("action:" + event.getAction());
        tags.add("result:" + event.getResult());
        tags.add("sensitivity:" + event.getSensitivity());
        if (event.getUserRoles() != null) {
            for (String role : new TreeSet<>(event.getUserRoles())) {
                tags.add("role:" + role);
            }
        }
        return tags;
    }
}
