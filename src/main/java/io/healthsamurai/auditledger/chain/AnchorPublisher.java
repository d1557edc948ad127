package io.healthsamurai.auditledger.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.storage.BlobStore;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a signed anchor to the blob store every {@code interval} records.
 */
public class AnchorPublisher {

    private static final Logger log = LoggerFactory.getLogger(AnchorPublisher.class);

    static final String ANCHOR_PREFIX = "audit-anchors/";

    private final AnchorSigner signer;
    private final BlobStore blobStore;
    private final int interval;
    private final Clock clock;

    public AnchorPublisher(AnchorSigner signer, BlobStore blobStore, int interval, Clock clock) {
        if (interval <= 0) {
            throw new IllegalArgumentException("Anchor interval must be positive: " + interval);
        }
        this.signer = signer;
        this.blobStore = blobStore;
        this.interval = interval;
        this.clock = clock;
    }

    /**
     * Publishes an anchor for the record if its sequence number falls on the interval.
     * Failures are logged and reported as an empty result.
     */
    public Optional<ChainAnchor> publishIfDue(ImmutableAuditRecord record) {
        if (record.getSequenceNumber() % interval != 0) {
            return Optional.empty();
        }

        ChainAnchor anchor = signer.createAnchor(record.getSequenceNumber(), record.getRecordHash(), clock.instant());
        try {
            blobStore.putIfAbsent(anchorKey(anchor.sequenceNumber()),
                    JsonUtil.toJson(toDocument(anchor)).getBytes(StandardCharsets.UTF_8));
            log.info("Published chain anchor at sequence {}", anchor.sequenceNumber());
            return Optional.of(anchor);
        } catch (Exception e) {
            log.warn("Failed to publish chain anchor at sequence {}: {} - {}",
                    anchor.sequenceNumber(), e.getClass().getSimpleName(), e.getMessage());
            if (log.isDebugEnabled()) {
                log.debug("Full error:", e);
            }
            return Optional.empty();
        }
    }

    public static String anchorKey(long sequenceNumber) {
        return ANCHOR_PREFIX + sequenceNumber + ".json";
    }

    static ObjectNode toDocument(ChainAnchor anchor) {
        ObjectNode node = JsonUtil.createObjectNode();
        node.put("sequenceNumber", anchor.sequenceNumber());
        node.put("recordHash", anchor.recordHash());
        node.put("signature", anchor.signature());
        node.put("algorithm", "HmacSHA256");
        node.put("createdAt", DateTimeFormatter.ISO_INSTANT.format(anchor.createdAt()));
        return node;
    }

    /**
     * @throws IllegalArgumentException if the document is not an anchor
     */
    static ChainAnchor fromDocument(JsonNode node) {
        if (node == null || !node.isObject() || !node.path("sequenceNumber").canConvertToLong()
                || !node.hasNonNull("recordHash") || !node.hasNonNull("signature")) {
            throw new IllegalArgumentException("Not a chain anchor document");
        }
        Instant createdAt = null;
        if (node.hasNonNull("createdAt")) {
            try {
                createdAt = Instant.parse(node.get("createdAt").asText());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid anchor createdAt: " + node.get("createdAt").asText(), e);
            }
        }
        return new ChainAnchor(node.get("sequenceNumber").asLong(), node.get("recordHash").asText(),
                node.get("signature").asText(), createdAt);
    }
}
