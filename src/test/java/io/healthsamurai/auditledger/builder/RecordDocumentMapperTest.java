package io.healthsamurai.auditledger.builder;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.healthsamurai.auditledger.TestEvents;
import io.healthsamurai.auditledger.chain.HashChainEngine;
import io.healthsamurai.auditledger.model.AuditEvent;
import io.healthsamurai.auditledger.model.GeoLocation;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.retention.RetentionPolicy;
import io.healthsamurai.auditledger.retention.RetentionPolicyResolver;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Tests for RecordDocumentMapper.
 * A reloaded record must hash to the value it was stored with.
 */
class RecordDocumentMapperTest {

    private static final Instant CREATED_AT = Instant.parse("2024-03-15T10:20:00Z");

    private final HashChainEngine engine = new HashChainEngine();
    private final AuditRecordBuilder builder = new AuditRecordBuilder(engine,
            new RetentionPolicyResolver(RetentionPolicy.defaults()), () -> "rec-42");
    private final AuditEventValidator validator = new AuditEventValidator();

    @Test
    void toDocument_ContainsRecordAndEventFields() {
        ImmutableAuditRecord record = build(TestEvents.loginSuccess("u1").build());

        ObjectNode document = RecordDocumentMapper.toDocument(record);

        assertEquals("rec-42", document.path("recordId").asText());
        assertEquals(3, document.path("sequenceNumber").asLong());
        assertEquals("AUTH_EVENT", document.path("eventType").asText());
        assertEquals("LOGIN_SUCCESS", document.path("action").asText());
        assertEquals("fleet-manager", document.path("userRoles").get(0).asText());
        assertEquals("2024-03-15T10:15:30.123Z", document.path("timestamp").asText());
        assertEquals("sess-u1", document.path("sessionId").asText());
        assertEquals(2555, document.path("retentionDays").asInt());
        assertFalse(document.has("storageLocations"));
        assertFalse(document.has("geoLocation"));
    }

    @Test
    void toDocument_IndefiniteRetention_NullAutoDeleteAt() {
        ImmutableAuditRecord record = build(TestEvents.vehicleRead("u1").build()).toBuilder()
                .retentionDays(RetentionPolicyResolver.INDEFINITE)
                .autoDeleteAt(null)
                .build();

        ObjectNode document = RecordDocumentMapper.toDocument(record);

        assertTrue(document.has("autoDeleteAt"));
        assertTrue(document.get("autoDeleteAt").isNull());
        assertEquals(-1, document.path("retentionDays").asInt());
    }

    @Test
    void fromDocument_ReloadedRecord_SameHash() throws Exception {
        AuditEvent event = TestEvents.vehicleRead("u1")
                .detail("nested", Map.of("zone", "north", "count", 2))
                .detail("ids", List.of(1, 2, 3))
                .geoLocation(new GeoLocation("DE", "Berlin", "Berlin"))
                .build();
        ImmutableAuditRecord record = build(event);

        String json = JsonUtil.toJson(RecordDocumentMapper.toDocument(record));
        ImmutableAuditRecord reloaded = RecordDocumentMapper.fromDocument(JsonUtil.parseJson(json));

        assertEquals(record.getRecordHash(), reloaded.getRecordHash());
        assertEquals(record.getRecordHash(), engine.computeHash(reloaded));
        assertEquals(record.getEvent().getGeoLocation(), reloaded.getEvent().getGeoLocation());
        assertEquals(record.getAutoDeleteAt(), reloaded.getAutoDeleteAt());
        assertEquals(record.getCreatedAt(), reloaded.getCreatedAt());
        assertEquals(record.getEvent().getUserRoles(), reloaded.getEvent().getUserRoles());
        assertTrue(reloaded.isBlockchainVerified());
        assertEquals(0, reloaded.getStorageLocations().successCount());
    }

    @Test
    void fromDocument_MissingEventType_Throws() {
        ObjectNode document = RecordDocumentMapper.toDocument(build(TestEvents.vehicleRead("u1").build()));
        document.remove("eventType");

        assertThrows(IllegalArgumentException.class, () -> RecordDocumentMapper.fromDocument(document));
    }

    @Test
    void fromDocument_UnknownAction_Throws() {
        ObjectNode document = RecordDocumentMapper.toDocument(build(TestEvents.vehicleRead("u1").build()));
        document.put("action", "TELEPORT");

        assertThrows(IllegalArgumentException.class, () -> RecordDocumentMapper.fromDocument(document));
    }

    @Test
    void fromDocument_InvalidTimestamp_Throws() {
        ObjectNode document = RecordDocumentMapper.toDocument(build(TestEvents.vehicleRead("u1").build()));
        document.put("createdAt", "yesterday");

        assertThrows(IllegalArgumentException.class, () -> RecordDocumentMapper.fromDocument(document));
    }

    @Test
    void fromDocument_GenesisRecord_EmptyPreviousHash() {
        ImmutableAuditRecord first = builder.build(validator.validate(TestEvents.loginSuccess("u1").build(), CREATED_AT),
                1, HashChainEngine.GENESIS_HASH, HashChainEngine.GENESIS_HASH, CREATED_AT);

        JsonNode document = RecordDocumentMapper.toDocument(first);
        ImmutableAuditRecord reloaded = RecordDocumentMapper.fromDocument(document);

        assertEquals("", reloaded.getPreviousRecordHash());
        assertEquals(first.getRecordHash(), engine.computeHash(reloaded));
    }

    private ImmutableAuditRecord build(AuditEvent event) {
        return builder.build(validator.validate(event, CREATED_AT), 3, "prev-hash", "prev-hash", CREATED_AT);
    }
}
