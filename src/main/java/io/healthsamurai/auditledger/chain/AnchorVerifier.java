package io.healthsamurai.auditledger.chain;

import com.fasterxml.jackson.databind.JsonNode;
import io.healthsamurai.auditledger.exception.StorageException;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.storage.BlobStore;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the anchors written by {@link AnchorPublisher} back from the blob store and checks the
 * stored chain against them.
 *
 * <p>A chain that was rewritten and re-hashed end to end still verifies link by link, but its
 * hashes no longer match the signed anchors. Anchors published past the last stored record reveal
 * a chain that was cut short.
 */
public class AnchorVerifier {

    private static final Logger log = LoggerFactory.getLogger(AnchorVerifier.class);

    private final AnchorSigner signer;
    private final BlobStore blobStore;
    private final int interval;

    public AnchorVerifier(AnchorSigner signer, BlobStore blobStore, int interval) {
        if (interval <= 0) {
            throw new IllegalArgumentException("Anchor interval must be positive: " + interval);
        }
        this.signer = signer;
        this.blobStore = blobStore;
        this.interval = interval;
    }

    /**
     * @param records Stored records in ascending sequence order
     * @throws StorageException if an anchor cannot be read
     */
    public AnchorVerificationResult verify(List<ImmutableAuditRecord> records) throws StorageException {
        List<BrokenLink> failures = new ArrayList<>();
        int checked = 0;
        int missing = 0;
        long lastSequence = 0;

        for (ImmutableAuditRecord record : records) {
            lastSequence = Math.max(lastSequence, record.getSequenceNumber());
            if (record.getSequenceNumber() % interval != 0) {
                continue;
            }
            int failuresBefore = failures.size();
            Optional<ChainAnchor> anchor = readAnchor(record.getSequenceNumber(), failures);
            if (anchor.isEmpty()) {
                if (failures.size() == failuresBefore) {
                    missing++;
                }
                continue;
            }
            checked++;
            if (!anchor.get().recordHash().equals(record.getRecordHash())) {
                failures.add(new BrokenLink(record.getSequenceNumber(), anchor.get().recordHash(),
                        record.getRecordHash(), BrokenLink.Reason.ANCHOR_MISMATCH));
            }
        }

        // Anchors beyond the stored tail mean records were removed from the end
        for (long next = (lastSequence / interval + 1) * interval; ; next += interval) {
            Optional<ChainAnchor> orphan = readAnchor(next, failures);
            if (orphan.isEmpty()) {
                break;
            }
            checked++;
            failures.add(new BrokenLink(next, orphan.get().recordHash(), "", BrokenLink.Reason.ANCHOR_MISMATCH));
        }

        if (failures.isEmpty()) {
            log.info("Chain anchors verified: {} checked, {} not published", checked, missing);
        } else {
            log.warn("Chain anchor verification found {} problems in {} anchors", failures.size(), checked);
        }
        return new AnchorVerificationResult(checked, missing, failures);
    }

    /**
     * Loads and checks the signature of one anchor. An unsigned or unreadable anchor is recorded
     * as a failure and reported as absent.
     */
    private Optional<ChainAnchor> readAnchor(long sequenceNumber, List<BrokenLink> failures) throws StorageException {
        Optional<byte[]> content = blobStore.get(AnchorPublisher.anchorKey(sequenceNumber));
        if (content.isEmpty()) {
            return Optional.empty();
        }

        JsonNode node = JsonUtil.parseJson(new String(content.get(), StandardCharsets.UTF_8));
        ChainAnchor anchor;
        try {
            anchor = AnchorPublisher.fromDocument(node);
        } catch (IllegalArgumentException e) {
            failures.add(new BrokenLink(sequenceNumber, "anchor document", "unreadable",
                    BrokenLink.Reason.ANCHOR_SIGNATURE_INVALID));
            return Optional.empty();
        }

        if (anchor.sequenceNumber() != sequenceNumber || !signer.verify(anchor)) {
            failures.add(new BrokenLink(sequenceNumber, "valid signature", anchor.signature(),
                    BrokenLink.Reason.ANCHOR_SIGNATURE_INVALID));
            return Optional.empty();
        }
        return Optional.of(anchor);
    }
}
