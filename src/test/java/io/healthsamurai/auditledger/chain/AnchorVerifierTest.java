package io.healthsamurai.auditledger.chain;

import static org.junit.jupiter.api.Assertions.*;

import io.healthsamurai.auditledger.TestEvents;
import io.healthsamurai.auditledger.builder.AuditRecordBuilder;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.retention.RetentionPolicy;
import io.healthsamurai.auditledger.retention.RetentionPolicyResolver;
import io.healthsamurai.auditledger.storage.FileSystemBlobStore;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnchorVerifierTest {

    private static final Instant NOW = Instant.parse("2024-03-15T11:00:00Z");

    @TempDir
    Path tempDir;

    private final HashChainEngine engine = new HashChainEngine();
    private final AnchorSigner signer = new AnchorSigner("anchor-secret");
    private FileSystemBlobStore blobStore;
    private AuditRecordBuilder builder;
    private AnchorVerifier verifier;

    @BeforeEach
    void setUp() {
        blobStore = new FileSystemBlobStore(tempDir);
        builder = new AuditRecordBuilder(engine, new RetentionPolicyResolver(RetentionPolicy.defaults()));
        verifier = new AnchorVerifier(signer, blobStore, 2);
    }

    @Test
    void verify_AnchorsMatchChain_Ok() throws Exception {
        List<ImmutableAuditRecord> chain = publishedChain(5, "u");

        AnchorVerificationResult result = verifier.verify(chain);

        assertTrue(result.ok());
        assertEquals(2, result.anchorsChecked());
        assertEquals(0, result.anchorsMissing());
    }

    @Test
    void verify_ChainRewrittenAndRehashed_AnchorMismatch() throws Exception {
        publishedChain(4, "u");
        // A forger rebuilds a fully consistent chain with different content
        List<ImmutableAuditRecord> forged = buildChain(4, "forged");
        assertTrue(engine.verifyChain(forged).ok());

        AnchorVerificationResult result = verifier.verify(forged);

        assertFalse(result.ok());
        assertEquals(2, result.failures().size());
        assertTrue(result.failures().stream().allMatch(link -> link.reason() == BrokenLink.Reason.ANCHOR_MISMATCH));
        assertEquals(List.of(2L, 4L), result.failures().stream().map(BrokenLink::sequenceNumber).toList());
    }

    @Test
    void verify_TailRemoved_AnchorPastEndReported() throws Exception {
        List<ImmutableAuditRecord> chain = publishedChain(6, "u");

        AnchorVerificationResult result = verifier.verify(chain.subList(0, 3));

        assertFalse(result.ok());
        assertEquals(List.of(4L, 6L), result.failures().stream().map(BrokenLink::sequenceNumber).toList());
        assertEquals("", result.failures().get(0).actual());
    }

    @Test
    void verify_AnchorSignedWithOtherKey_SignatureInvalid() throws Exception {
        List<ImmutableAuditRecord> chain = buildChain(2, "u");
        AnchorPublisher otherKey = new AnchorPublisher(new AnchorSigner("other-secret"), blobStore, 2,
                Clock.fixed(NOW, ZoneOffset.UTC));
        otherKey.publishIfDue(chain.get(1));

        AnchorVerificationResult result = verifier.verify(chain);

        assertEquals(1, result.failures().size());
        assertEquals(BrokenLink.Reason.ANCHOR_SIGNATURE_INVALID, result.failures().get(0).reason());
        assertEquals(0, result.anchorsMissing());
    }

    @Test
    void verify_UnreadableAnchor_SignatureInvalid() throws Exception {
        List<ImmutableAuditRecord> chain = buildChain(2, "u");
        blobStore.putIfAbsent(AnchorPublisher.anchorKey(2), "not json".getBytes(StandardCharsets.UTF_8));

        AnchorVerificationResult result = verifier.verify(chain);

        assertEquals(BrokenLink.Reason.ANCHOR_SIGNATURE_INVALID, result.failures().get(0).reason());
    }

    @Test
    void verify_AnchorNeverPublished_CountedAsMissing() throws Exception {
        List<ImmutableAuditRecord> chain = buildChain(4, "u");

        AnchorVerificationResult result = verifier.verify(chain);

        assertTrue(result.ok());
        assertEquals(0, result.anchorsChecked());
        assertEquals(2, result.anchorsMissing());
    }

    @Test
    void constructor_NonPositiveInterval_Throws() {
        assertThrows(IllegalArgumentException.class, () -> new AnchorVerifier(signer, blobStore, 0));
    }

    private List<ImmutableAuditRecord> publishedChain(int length, String userPrefix) {
        AnchorPublisher publisher = new AnchorPublisher(signer, blobStore, 2, Clock.fixed(NOW, ZoneOffset.UTC));
        List<ImmutableAuditRecord> chain = buildChain(length, userPrefix);
        for (ImmutableAuditRecord record : chain) {
            publisher.publishIfDue(record);
        }
        return chain;
    }

    private List<ImmutableAuditRecord> buildChain(int length, String userPrefix) {
        List<ImmutableAuditRecord> chain = new ArrayList<>();
        String previous = HashChainEngine.GENESIS_HASH;
        for (int i = 1; i <= length; i++) {
            ImmutableAuditRecord record = builder.build(TestEvents.vehicleRead(userPrefix + i).build(), i,
                    previous, previous, NOW);
            chain.add(record);
            previous = record.getRecordHash();
        }
        return chain;
    }
}
