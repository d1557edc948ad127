package io.healthsamurai.auditledger.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.healthsamurai.auditledger.exception.StorageException;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.storage.AuditQuery;
import io.healthsamurai.auditledger.storage.AuditRecordStore;
import io.healthsamurai.auditledger.storage.BlobStore;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes and verifies signed daily digests under {@code audit-digests/digest-<yyyy-MM-dd>.json}.
 *
 * <p>A digest pins the number of records of a UTC day, their sequence range and the hash of the
 * last one. Verification recomputes all of it from the record database, so records added,
 * removed or rewritten after publication make the digest fail.
 */
public class DigestPublisher {

    private static final Logger log = LoggerFactory.getLogger(DigestPublisher.class);

    static final String DIGEST_PREFIX = "audit-digests/";

    private final AuditRecordStore recordStore;
    private final BlobStore blobStore;
    private final AnchorSigner signer;
    private final HashChainEngine hashChainEngine;
    private final Clock clock;

    public DigestPublisher(AuditRecordStore recordStore, BlobStore blobStore, AnchorSigner signer,
                           HashChainEngine hashChainEngine, Clock clock) {
        this.recordStore = recordStore;
        this.blobStore = blobStore;
        this.signer = signer;
        this.hashChainEngine = hashChainEngine;
        this.clock = clock;
    }

    /**
     * Publishes the digest of yesterday (UTC).
     */
    public DailyDigest publishDailyDigest() throws StorageException {
        return publishDailyDigest(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(1));
    }

    /**
     * Publishes the digest of one day. A day can be published only once.
     *
     * @throws IllegalStateException if no stored record has an event on that day
     * @throws StorageException if the records cannot be read or the digest already exists
     */
    public DailyDigest publishDailyDigest(LocalDate date) throws StorageException {
        List<ImmutableAuditRecord> records = recordsOn(date);
        if (records.isEmpty()) {
            throw new IllegalStateException("No audit records found for " + date);
        }

        ImmutableAuditRecord last = records.get(records.size() - 1);
        long startSequence = records.get(0).getSequenceNumber();
        String digestHash = digestHash(date, records.size(), startSequence, last.getSequenceNumber(),
                last.getRecordHash());

        DailyDigest digest = new DailyDigest(date, records.size(), startSequence, last.getSequenceNumber(),
                last.getRecordHash(), digestHash, signer.sign(digestHash), clock.instant());

        try {
            blobStore.putIfAbsent(digestKey(date),
                    JsonUtil.toPrettyJson(toDocument(digest)).getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize digest for " + date, e);
        }
        log.info("Published audit digest for {}: {} records, sequences {}-{}",
                date, digest.totalRecords(), digest.startSequence(), digest.endSequence());
        return digest;
    }

    /**
     * Checks a published digest: its signature, and that the record database still yields the same
     * digest and an intact chain over the digest's sequence range.
     *
     * @return false if the digest is missing, unsigned, or no longer matches the stored records
     * @throws StorageException if the digest or the records cannot be read
     */
    public boolean verifyDigest(LocalDate date) throws StorageException {
        Optional<DailyDigest> published = readDigest(date);
        if (published.isEmpty()) {
            log.warn("No readable audit digest published for {}", date);
            return false;
        }
        DailyDigest digest = published.get();

        if (!signer.verify(digest.digestHash(), digest.signature())) {
            log.warn("Audit digest for {} has an invalid signature", date);
            return false;
        }

        List<ImmutableAuditRecord> records = recordsOn(date);
        if (records.isEmpty()) {
            log.warn("Audit digest for {} covers {} records, none are stored", date, digest.totalRecords());
            return false;
        }
        ImmutableAuditRecord last = records.get(records.size() - 1);
        String current = digestHash(date, records.size(), records.get(0).getSequenceNumber(),
                last.getSequenceNumber(), last.getRecordHash());
        if (!current.equals(digest.digestHash())) {
            log.warn("Audit digest for {} no longer matches the stored records: {} records now, {} published",
                    date, records.size(), digest.totalRecords());
            return false;
        }

        ChainVerificationResult chain = hashChainEngine.verifyChain(
                recordStore.findBySequenceRange(digest.startSequence(), digest.endSequence()));
        if (!chain.ok()) {
            log.warn("Audit chain for {} has {} broken links", date, chain.brokenLinks().size());
            return false;
        }
        return true;
    }

    public Optional<DailyDigest> readDigest(LocalDate date) throws StorageException {
        Optional<byte[]> content = blobStore.get(digestKey(date));
        if (content.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(fromDocument(JsonUtil.parseJson(new String(content.get(), StandardCharsets.UTF_8))));
        } catch (IllegalArgumentException e) {
            log.warn("Unreadable audit digest for {}: {}", date, e.getMessage());
            return Optional.empty();
        }
    }

    public static String digestKey(LocalDate date) {
        return DIGEST_PREFIX + "digest-" + DateTimeFormatter.ISO_LOCAL_DATE.format(date) + ".json";
    }

    private List<ImmutableAuditRecord> recordsOn(LocalDate date) throws StorageException {
        Instant from = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1);
        return recordStore.query(AuditQuery.builder().from(from).to(to).limit(Integer.MAX_VALUE).build())
                .stream()
                .sorted(Comparator.comparingLong(ImmutableAuditRecord::getSequenceNumber))
                .toList();
    }

    private static String digestHash(LocalDate date, int totalRecords, long startSequence, long endSequence,
                                     String lastRecordHash) {
        return HashChainEngine.sha256Hex(DateTimeFormatter.ISO_LOCAL_DATE.format(date) + "|" + totalRecords
                + "|" + startSequence + "|" + endSequence + "|" + lastRecordHash);
    }

    private static ObjectNode toDocument(DailyDigest digest) {
        ObjectNode node = JsonUtil.createObjectNode();
        node.put("digestDate", DateTimeFormatter.ISO_LOCAL_DATE.format(digest.digestDate()));
        node.put("totalRecords", digest.totalRecords());
        node.put("startSequence", digest.startSequence());
        node.put("endSequence", digest.endSequence());
        node.put("lastRecordHash", digest.lastRecordHash());
        node.put("digestHash", digest.digestHash());
        node.put("signature", digest.signature());
        node.put("algorithm", "HmacSHA256");
        node.put("publishedAt", DateTimeFormatter.ISO_INSTANT.format(digest.publishedAt()));
        return node;
    }

    private static DailyDigest fromDocument(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Not a digest document");
        }
        try {
            return new DailyDigest(
                    LocalDate.parse(node.path("digestDate").asText()),
                    node.path("totalRecords").asInt(),
                    node.path("startSequence").asLong(),
                    node.path("endSequence").asLong(),
                    node.path("lastRecordHash").asText(),
                    node.path("digestHash").asText(),
                    node.path("signature").asText(),
                    Instant.parse(node.path("publishedAt").asText()));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date in digest document: " + e.getParsedString(), e);
        }
    }
}
