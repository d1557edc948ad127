package io.healthsamurai.auditledger.chain;

import java.util.List;

/**
 * Outcome of checking stored records against their published anchors.
 *
 * @param anchorsChecked Anchors found and compared
 * @param anchorsMissing Anchor positions covered by the records with no anchor published
 * @param failures Anchors that did not match, were not validly signed, or outlived their record
 */
public record AnchorVerificationResult(int anchorsChecked, int anchorsMissing, List<BrokenLink> failures) {

    public AnchorVerificationResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean ok() {
        return failures.isEmpty();
    }
}
