package io.healthsamurai.auditledger.chain;

import java.util.List;

/**
 * Outcome of a full-chain verification.
 *
 * @param ok True when no broken link was found
 * @param brokenAt List index of the first record with a problem, or null
 * @param totalVerified Number of records walked
 * @param startSequence First sequence number walked, or null for an empty chain
 * @param endSequence Last sequence number walked, or null for an empty chain
 * @param brokenLinks Every problem found, in walk order
 */
public record ChainVerificationResult(
        boolean ok,
        Integer brokenAt,
        int totalVerified,
        Long startSequence,
        Long endSequence,
        List<BrokenLink> brokenLinks) {

    public ChainVerificationResult {
        brokenLinks = brokenLinks == null ? List.of() : List.copyOf(brokenLinks);
    }

    static ChainVerificationResult empty() {
        return new ChainVerificationResult(true, null, 0, null, null, List.of());
    }
}
