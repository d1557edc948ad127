package io.healthsamurai.auditledger.storage;

import io.healthsamurai.auditledger.model.StorageLocations;

/**
 * Minimum set of backends that must accept a record for the write to count as durable.
 */
public enum QuorumPolicy {

    /** Best effort: any outcome, including no backend at all, is accepted */
    NONE,

    /** At least one of the three backends */
    ANY,

    /** The database or the blob store; the SIEM copy alone is not enough */
    DATABASE_OR_BLOB;

    public boolean isSatisfiedBy(StorageLocations locations) {
        return switch (this) {
            case NONE -> true;
            case ANY -> locations.successCount() > 0;
            case DATABASE_OR_BLOB -> locations.isDatabase() || locations.isBlobStore();
        };
    }

    /**
     * Parses a configuration value such as {@code database_or_blob}. Null or unknown values map to
     * {@link #NONE}.
     */
    public static QuorumPolicy fromConfigValue(String value) {
        if (value == null) {
            return NONE;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
