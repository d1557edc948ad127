package io.healthsamurai.auditledger.retention;

import io.healthsamurai.auditledger.model.EventType;
import io.healthsamurai.auditledger.model.Sensitivity;
import java.util.List;
import java.util.Set;

/**
 * Ordered retention rules; the first matching rule wins, otherwise {@code defaultDays} applies.
 */
public record RetentionPolicy(List<RetentionRule> rules, int defaultDays) {

    public static final int SEVEN_YEARS_DAYS = 2555;
    public static final int THREE_YEARS_DAYS = 1095;
    public static final int ONE_YEAR_DAYS = 365;

    public RetentionPolicy {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * The compiled-in tiers: confidential and restricted data for seven years, security and
     * authentication events for three, everything else for one.
     */
    public static RetentionPolicy defaults() {
        return new RetentionPolicy(List.of(
                new RetentionRule("protected-data",
                        Set.of(Sensitivity.RESTRICTED, Sensitivity.CONFIDENTIAL), Set.of(), SEVEN_YEARS_DAYS),
                new RetentionRule("security-and-auth",
                        Set.of(), Set.of(EventType.SECURITY_EVENT, EventType.AUTH_EVENT), THREE_YEARS_DAYS)
        ), ONE_YEAR_DAYS);
    }
}
