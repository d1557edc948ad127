package io.healthsamurai.auditledger.builder;

import io.healthsamurai.auditledger.chain.HashChainEngine;
import io.healthsamurai.auditledger.model.AuditEvent;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.retention.RetentionPolicyResolver;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles a complete record from a validated event plus the chain position assigned by the
 * ledger.
 */
public class AuditRecordBuilder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecordBuilder.class);

    private final HashChainEngine hashChainEngine;
    private final RetentionPolicyResolver retentionResolver;
    private final Supplier<String> recordIdGenerator;

    public AuditRecordBuilder(HashChainEngine hashChainEngine, RetentionPolicyResolver retentionResolver) {
        this(hashChainEngine, retentionResolver, () -> UUID.randomUUID().toString());
    }

    public AuditRecordBuilder(HashChainEngine hashChainEngine, RetentionPolicyResolver retentionResolver,
                              Supplier<String> recordIdGenerator) {
        this.hashChainEngine = hashChainEngine;
        this.retentionResolver = retentionResolver;
        this.recordIdGenerator = recordIdGenerator;
    }

    /**
     * Builds and hashes a record.
     *
     * <p>{@code blockchainVerified} compares {@code previousRecordHash} with
     * {@code lastCommittedHash}. {@link io.healthsamurai.auditledger.AuditLedger} passes its own
     * last hash as both while holding the chain lock, so for ledger-built records the flag is always
     * true. It can only be false for a caller that links a record to something other than the
     * ledger's current head, such as a replay or import tool.
     *
     * @param event Validated event
     * @param sequenceNumber Position assigned by the ledger
     * @param previousRecordHash Hash the record links to
     * @param lastCommittedHash The ledger's last committed hash, used for {@code blockchainVerified}
     * @param createdAt Ledger clock reading
     * @return The finished record
     */
    public ImmutableAuditRecord build(AuditEvent event, long sequenceNumber, String previousRecordHash,
                                      String lastCommittedHash, Instant createdAt) {
        int retentionDays = retentionResolver.retentionDays(event.getSensitivity(), event.getEventType());

        ImmutableAuditRecord unsigned = ImmutableAuditRecord.builder()
                .recordId(recordIdGenerator.get())
                .sequenceNumber(sequenceNumber)
                .previousRecordHash(previousRecordHash)
                .event(event)
                .createdAt(createdAt)
                .retentionDays(retentionDays)
                .autoDeleteAt(retentionResolver.autoDeleteAt(createdAt, retentionDays))
                .build();

        boolean linked = hashChainEngine.verifyLink(unsigned, lastCommittedHash);
        if (!linked) {
            log.warn("Record {} links to {} but the last committed hash is {}",
                    sequenceNumber, previousRecordHash, lastCommittedHash);
        }

        return unsigned.toBuilder()
                .recordHash(hashChainEngine.computeHash(unsigned))
                .blockchainVerified(linked)
                .build();
    }
}
