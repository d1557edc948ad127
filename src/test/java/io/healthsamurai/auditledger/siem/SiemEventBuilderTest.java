package io.healthsamurai.auditledger.siem;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.healthsamurai.auditledger.TestEvents;
import io.healthsamurai.auditledger.model.EventType;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SiemEventBuilderTest {

    private final SiemEventBuilder siemEventBuilder = new SiemEventBuilder(new SeverityClassifier());

    @Test
    void buildSiemEvent_ContainsRecordSeverityAndTags() {
        ImmutableAuditRecord record = ImmutableAuditRecord.builder()
                .recordId("rec-7")
                .sequenceNumber(7)
                .previousRecordHash("prev")
                .recordHash("hash")
                .blockchainVerified(true)
                .event(TestEvents.vehicleRead("u1").eventType(EventType.SECURITY_EVENT).build())
                .createdAt(Instant.parse("2024-03-15T10:20:00Z"))
                .retentionDays(1095)
                .build();

        ObjectNode document = siemEventBuilder.buildSiemEvent(record);

        assertEquals("rec-7", document.path("recordId").asText());
        assertEquals(7, document.path("sequenceNumber").asLong());
        assertEquals("hash", document.path("recordHash").asText());
        assertEquals("u1", document.path("userId").asText());
        assertEquals("audit-ledger", document.path("source").asText());
        assertEquals("CRITICAL", document.path("severity").asText());
        assertTrue(document.path("tags").isArray());
        assertEquals("event:SECURITY_EVENT", document.path("tags").get(0).asText());
        assertEquals("role:dispatcher", document.path("tags").get(4).asText());
    }
}
