package io.healthsamurai.auditledger.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.healthsamurai.auditledger.model.AuditEvent;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes record digests and checks the links between consecutive records.
 *
 * <p>The digest is SHA-256 over a canonical JSON rendering of the record's logical fields:
 * identity, sequence number, previous hash, event type, action, actor, resource, timestamp,
 * result and details. Storage status, retention metadata and the hash itself are excluded, so
 * the value is stable across storage retries and reloads.
 */
public class HashChainEngine {

    /** Previous-hash value of the first record in a ledger */
    public static final String GENESIS_HASH = "";

    private static final String DIGEST_ALGORITHM = "SHA-256";

    /**
     * Computes the digest of a record's logical fields.
     *
     * @param record The record; its {@code recordHash} is ignored
     * @return Lowercase hex SHA-256
     */
    public String computeHash(ImmutableAuditRecord record) {
        try {
            return sha256Hex(JsonUtil.toCanonicalJson(canonicalFields(record)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize record " + record.getRecordId() + " for hashing", e);
        }
    }

    /**
     * @return Lowercase hex SHA-256 of the UTF-8 bytes of {@code value}
     */
    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance(DIGEST_ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " not available in this JVM", e);
        }
    }

    /**
     * @return true if the record points at {@code expectedPreviousHash}
     */
    public boolean verifyLink(ImmutableAuditRecord record, String expectedPreviousHash) {
        return Objects.equals(normalize(record.getPreviousRecordHash()), normalize(expectedPreviousHash));
    }

    /**
     * Re-walks a stored sequence: recomputes every digest, checks each link to the predecessor
     * and checks that sequence numbers are contiguous.
     *
     * @param records Records in ascending sequence order
     * @return The verification outcome; {@code brokenAt} is the list index of the first bad record
     */
    public ChainVerificationResult verifyChain(List<ImmutableAuditRecord> records) {
        if (records == null || records.isEmpty()) {
            return ChainVerificationResult.empty();
        }

        List<BrokenLink> brokenLinks = new ArrayList<>();
        Integer brokenAt = null;
        ImmutableAuditRecord previous = null;

        for (int i = 0; i < records.size(); i++) {
            ImmutableAuditRecord record = records.get(i);
            int before = brokenLinks.size();

            String expectedHash = computeHash(record);
            if (!expectedHash.equals(record.getRecordHash())) {
                brokenLinks.add(new BrokenLink(record.getSequenceNumber(), expectedHash,
                        record.getRecordHash(), BrokenLink.Reason.HASH_MISMATCH));
            }

            if (previous != null) {
                if (record.getSequenceNumber() != previous.getSequenceNumber() + 1) {
                    brokenLinks.add(new BrokenLink(record.getSequenceNumber(),
                            String.valueOf(previous.getSequenceNumber() + 1),
                            String.valueOf(record.getSequenceNumber()), BrokenLink.Reason.SEQUENCE_GAP));
                }
                if (!verifyLink(record, previous.getRecordHash())) {
                    brokenLinks.add(new BrokenLink(record.getSequenceNumber(), previous.getRecordHash(),
                            record.getPreviousRecordHash(), BrokenLink.Reason.LINK_MISMATCH));
                }
            } else if (record.getSequenceNumber() == 1 && !verifyLink(record, GENESIS_HASH)) {
                brokenLinks.add(new BrokenLink(record.getSequenceNumber(), GENESIS_HASH,
                        record.getPreviousRecordHash(), BrokenLink.Reason.LINK_MISMATCH));
            }

            if (brokenAt == null && brokenLinks.size() > before) {
                brokenAt = i;
            }
            previous = record;
        }

        return new ChainVerificationResult(
                brokenLinks.isEmpty(),
                brokenAt,
                records.size(),
                records.get(0).getSequenceNumber(),
                records.get(records.size() - 1).getSequenceNumber(),
                brokenLinks);
    }

    private Map<String, Object> canonicalFields(ImmutableAuditRecord record) {
        AuditEvent event = record.getEvent();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("recordId", record.getRecordId());
        fields.put("sequenceNumber", record.getSequenceNumber());
        fields.put("previousRecordHash", normalize(record.getPreviousRecordHash()));
        fields.put("eventType", event.getEventType() != null ? event.getEventType().name() : "");
        fields.put("action", event.getAction() != null ? event.getAction().name() : "");
        fields.put("userId", normalize(event.getUserId()));
        fields.put("resource", normalize(event.getResource()));
        fields.put("resourceId", normalize(event.getResourceId()));
        fields.put("timestamp", event.getTimestamp() != null
                ? DateTimeFormatter.ISO_INSTANT.format(event.getTimestamp()) : "");
        fields.put("result", event.getResult() != null ? event.getResult().name() : "");
        fields.put("details", event.getDetails() != null ? event.getDetails() : Map.of());
        return fields;
    }

    private static String normalize(String value) {
        return value == null ? "" : value;
    }
}
