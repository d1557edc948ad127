package io.healthsamurai.auditledger.chain;

import java.time.Instant;
import java.util.List;

/**
 * Produced by {@link ChainAuditor#detectTampering()} when the stored chain does not verify.
 */
public record TamperingReport(
        String reportId,
        Instant detectedAt,
        long startSequence,
        long endSequence,
        List<BrokenLink> brokenLinks,
        Severity severity) {

    public TamperingReport {
        brokenLinks = List.copyOf(brokenLinks);
    }

    public int totalBrokenLinks() {
        return brokenLinks.size();
    }

    public enum Severity {
        WARNING,
        ERROR,
        CRITICAL;

        /**
         * More than 100 broken links is critical, more than 10 is an error.
         */
        public static Severity forBrokenLinkCount(int count) {
            if (count > 100) {
                return CRITICAL;
            }
            if (count > 10) {
                return ERROR;
            }
            return WARNING;
        }
    }
}
