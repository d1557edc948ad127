package io.healthsamurai.auditledger.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.healthsamurai.auditledger.model.AuditAction;
import io.healthsamurai.auditledger.model.AuditEvent;
import io.healthsamurai.auditledger.model.AuditResult;
import io.healthsamurai.auditledger.model.EventType;
import io.healthsamurai.auditledger.model.GeoLocation;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.model.Sensitivity;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Converts records to and from the JSON document written to every backend.
 * Timestamps are ISO-8601 strings. Storage status is not part of the document.
 */
public final class RecordDocumentMapper {

    private RecordDocumentMapper() {
        // Utility class
    }

    /**
     * Builds the persisted document for a record.
     *
     * @param record The record
     * @return A new ObjectNode
     */
    public static ObjectNode toDocument(ImmutableAuditRecord record) {
        AuditEvent event = record.getEvent();
        ObjectNode document = JsonUtil.createObjectNode();

        document.put("recordId", record.getRecordId());
        document.put("sequenceNumber", record.getSequenceNumber());
        document.put("previousRecordHash", record.getPreviousRecordHash());
        document.put("recordHash", record.getRecordHash());
        document.put("blockchainVerified", record.isBlockchainVerified());

        document.put("eventType", nameOf(event.getEventType()));
        document.put("action", nameOf(event.getAction()));
        document.put("userId", event.getUserId());
        ArrayNode roles = document.putArray("userRoles");
        if (event.getUserRoles() != null) {
            new TreeSet<>(event.getUserRoles()).forEach(roles::add);
        }
        document.put("resource", event.getResource());
        document.put("resourceId", event.getResourceId());
        document.put("timestamp", formatInstant(event.getTimestamp()));
        document.put("ipAddress", event.getIpAddress());
        document.put("userAgent", event.getUserAgent());
        document.put("result", nameOf(event.getResult()));
        document.put("sensitivity", nameOf(event.getSensitivity()));
        document.set("details", JsonUtil.toTree(event.getDetails() != null ? event.getDetails() : Map.of()));

        if (event.getSessionId() != null) {
            document.put("sessionId", event.getSessionId());
        }
        if (event.getGeoLocation() != null) {
            ObjectNode geo = document.putObject("geoLocation");
            geo.put("country", event.getGeoLocation().country());
            geo.put("region", event.getGeoLocation().region());
            geo.put("city", event.getGeoLocation().city());
        }

        document.put("createdAt", formatInstant(record.getCreatedAt()));
        document.put("retentionDays", record.getRetentionDays());
        if (record.getAutoDeleteAt() != null) {
            document.put("autoDeleteAt", formatInstant(record.getAutoDeleteAt()));
        } else {
            document.putNull("autoDeleteAt");
        }

        return document;
    }

    /**
     * Reads a document written by {@link #toDocument(ImmutableAuditRecord)}.
     *
     * @param document The stored document
     * @return The reconstructed record, with no storage status set
     * @throws IllegalArgumentException if a required field is missing or has an unknown value
     */
    public static ImmutableAuditRecord fromDocument(JsonNode document) {
        List<String> roles = new ArrayList<>();
        JsonNode rolesNode = document.path("userRoles");
        if (rolesNode.isArray()) {
            rolesNode.forEach(role -> roles.add(role.asText()));
        }

        GeoLocation geoLocation = null;
        JsonNode geoNode = document.get("geoLocation");
        if (geoNode != null && geoNode.isObject()) {
            geoLocation = new GeoLocation(
                    textOrNull(geoNode, "country"),
                    textOrNull(geoNode, "region"),
                    textOrNull(geoNode, "city"));
        }

        JsonNode detailsNode = document.get("details");
        Map<String, Object> details = detailsNode != null && detailsNode.isObject()
                ? JsonUtil.toJsonMap(detailsNode) : Map.of();

        AuditEvent event = AuditEvent.builder()
                .eventType(EventType.valueOf(required(document, "eventType")))
                .action(AuditAction.valueOf(required(document, "action")))
                .userId(textOrNull(document, "userId"))
                .userRoles(roles)
                .resource(textOrNull(document, "resource"))
                .resourceId(textOrNull(document, "resourceId"))
                .timestamp(parseInstant(textOrNull(document, "timestamp")))
                .ipAddress(textOrNull(document, "ipAddress"))
                .userAgent(textOrNull(document, "userAgent"))
                .result(AuditResult.valueOf(required(document, "result")))
                .sensitivity(Sensitivity.valueOf(required(document, "sensitivity")))
                .details(details)
                .sessionId(textOrNull(document, "sessionId"))
                .geoLocation(geoLocation)
                .build();

        return ImmutableAuditRecord.builder()
                .recordId(required(document, "recordId"))
                .sequenceNumber(document.path("sequenceNumber").asLong())
                .previousRecordHash(document.path("previousRecordHash").asText(""))
                .recordHash(required(document, "recordHash"))
                .blockchainVerified(document.path("blockchainVerified").asBoolean(false))
                .event(event)
                .createdAt(parseInstant(textOrNull(document, "createdAt")))
                .retentionDays(document.path("retentionDays").asInt())
                .autoDeleteAt(parseInstant(textOrNull(document, "autoDeleteAt")))
                .build();
    }

    static String formatInstant(Instant instant) {
        return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + value, e);
        }
    }

    private static String nameOf(Enum<?> value) {
        return value == null ? null : value.name();
    }

    private static String required(JsonNode node, String field) {
        String value = textOrNull(node, field);
        if (value == null) {
            throw new IllegalArgumentException("Missing field: " + field);
        }
        return value;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
