package io.healthsamurai.auditledger;

import io.healthsamurai.auditledger.model.AuditAction;
import io.healthsamurai.auditledger.model.AuditEvent;
import io.healthsamurai.auditledger.model.AuditResult;
import io.healthsamurai.auditledger.model.EventType;
import io.healthsamurai.auditledger.model.Sensitivity;
import java.time.Instant;

/**
 * Event fixtures shared by the tests.
 */
public final class TestEvents {

    public static final Instant EVENT_TIME = Instant.parse("2024-03-15T10:15:30.123Z");

    private TestEvents() {
    }

    public static AuditEvent.AuditEventBuilder loginSuccess(String userId) {
        return AuditEvent.builder()
                .eventType(EventType.AUTH_EVENT)
                .action(AuditAction.LOGIN_SUCCESS)
                .userId(userId)
                .userRole("fleet-manager")
                .resource("session")
                .resourceId("sess-" + userId)
                .timestamp(EVENT_TIME)
                .ipAddress("10.1.2.3")
                .userAgent("Mozilla/5.0")
                .result(AuditResult.SUCCESS)
                .sensitivity(Sensitivity.CONFIDENTIAL)
                .sessionId("sess-" + userId);
    }

    public static AuditEvent.AuditEventBuilder vehicleRead(String userId) {
        return AuditEvent.builder()
                .eventType(EventType.DATA_ACCESS)
                .action(AuditAction.READ)
                .userId(userId)
                .userRole("dispatcher")
                .resource("vehicle")
                .resourceId("VH-1042")
                .timestamp(EVENT_TIME.plusSeconds(60))
                .ipAddress("10.1.2.3")
                .userAgent("Mozilla/5.0")
                .result(AuditResult.SUCCESS)
                .sensitivity(Sensitivity.INTERNAL)
                .detail("fields", "odometer,location");
    }
}
