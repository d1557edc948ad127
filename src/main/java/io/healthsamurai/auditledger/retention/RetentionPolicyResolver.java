package io.healthsamurai.auditledger.retention;

import io.healthsamurai.auditledger.model.EventType;
import io.healthsamurai.auditledger.model.Sensitivity;
import java.time.Duration;
import java.time.Instant;

/**
 * Maps sensitivity and event type to a retention period and expiry timestamp.
 */
public class RetentionPolicyResolver {

    /** Retention value meaning "never auto-delete" */
    public static final int INDEFINITE = -1;

    private final RetentionPolicy policy;

    /**
     * Creates a resolver using {@code retention-policy.yaml} from the classpath.
     */
    public RetentionPolicyResolver() {
        this(RetentionPolicyLoader.loadRetentionPolicy());
    }

    public RetentionPolicyResolver(RetentionPolicy policy) {
        this.policy = policy;
    }

    /**
     * @return retention in days, or {@link #INDEFINITE}
     */
    public int retentionDays(Sensitivity sensitivity, EventType eventType) {
        for (RetentionRule rule : policy.rules()) {
            if (rule.matches(sensitivity, eventType)) {
                return rule.days();
            }
        }
        return policy.defaultDays();
    }

    /**
     * @return {@code createdAt + retentionDays}, or null for indefinite retention
     */
    public Instant autoDeleteAt(Instant createdAt, int retentionDays) {
        if (retentionDays == INDEFINITE) {
            return null;
        }
        return createdAt.plus(Duration.ofDays(retentionDays));
    }

    public RetentionPolicy getPolicy() {
        return policy;
    }
}
