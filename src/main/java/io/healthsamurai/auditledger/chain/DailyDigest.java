package io.healthsamurai.auditledger.chain;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Signed summary of one UTC day of records, published to the blob store.
 *
 * @param digestDate Day covered, by event timestamp in UTC
 * @param totalRecords Number of stored records with an event on that day
 * @param startSequence Lowest sequence number among them
 * @param endSequence Highest sequence number among them
 * @param lastRecordHash Hash of the record at {@code endSequence}
 * @param digestHash SHA-256 over the fields above
 * @param signature HMAC-SHA256 of {@code digestHash}
 * @param publishedAt When the digest was written
 */
public record DailyDigest(
        LocalDate digestDate,
        int totalRecords,
        long startSequence,
        long endSequence,
        String lastRecordHash,
        String digestHash,
        String signature,
        Instant publishedAt) {}
