package io.healthsamurai.auditledger.config;

import io.healthsamurai.auditledger.storage.QuorumPolicy;

/**
 * Configuration constants for the audit ledger.
 * All settings can be configured via environment variables or system properties.
 */
public final class LedgerConfig {

    private LedgerConfig() {
        // Utility class
    }

    // ==================== Environment Variable Names ====================

    /** Path of the JSON-lines file backing the record database */
    public static final String AUDIT_DB_FILE = "AUDIT_DB_FILE";

    /** Root directory of the write-once blob store */
    public static final String AUDIT_BLOB_ROOT = "AUDIT_BLOB_ROOT";

    /** Enable/disable forwarding to the SIEM endpoint */
    public static final String AUDIT_SIEM_ENABLED = "AUDIT_SIEM_ENABLED";

    /** SIEM ingestion endpoint (e.g., https://siem.example.com/api/events) */
    public static final String AUDIT_SIEM_URL = "AUDIT_SIEM_URL";

    /** Authentication type for the SIEM endpoint: none, basic, bearer */
    public static final String AUDIT_SIEM_AUTH_TYPE = "AUDIT_SIEM_AUTH_TYPE";

    public static final String AUDIT_SIEM_AUTH_USERNAME = "AUDIT_SIEM_AUTH_USERNAME";

    public static final String AUDIT_SIEM_AUTH_PASSWORD = "AUDIT_SIEM_AUTH_PASSWORD";

    public static final String AUDIT_SIEM_AUTH_TOKEN = "AUDIT_SIEM_AUTH_TOKEN";

    /** Upper bound on each backend write, in seconds */
    public static final String AUDIT_STORAGE_TIMEOUT_SECONDS = "AUDIT_STORAGE_TIMEOUT_SECONDS";

    /** Minimum backend successes: none, any, database_or_blob */
    public static final String AUDIT_STORAGE_QUORUM = "AUDIT_STORAGE_QUORUM";

    /** Publish a signed anchor every N records (0 disables) */
    public static final String AUDIT_ANCHOR_INTERVAL = "AUDIT_ANCHOR_INTERVAL";

    /** HMAC secret for anchor signatures; anchors are off when empty */
    public static final String AUDIT_ANCHOR_KEY = "AUDIT_ANCHOR_KEY";

    /** Enable/disable debug mode (logs every committed record as pretty JSON) */
    public static final String AUDIT_DEBUG_ENABLED = "AUDIT_DEBUG_ENABLED";

    // ==================== Default Values ====================

    public static final String DEFAULT_DB_FILE = "audit-ledger/records.jsonl";
    public static final String DEFAULT_BLOB_ROOT = "audit-ledger/blobs";
    public static final boolean DEFAULT_SIEM_ENABLED = true;
    public static final String DEFAULT_SIEM_URL = "http://localhost:8088/siem/events";
    public static final String DEFAULT_AUTH_TYPE = "none";
    public static final int DEFAULT_STORAGE_TIMEOUT_SECONDS = 10;
    public static final String DEFAULT_STORAGE_QUORUM = "none";
    public static final int DEFAULT_ANCHOR_INTERVAL = 1000;
    public static final boolean DEFAULT_DEBUG_ENABLED = false;

    // ==================== HTTP Configuration ====================

    public static final int CONNECTION_TIMEOUT_SECONDS = 10;
    public static final int REQUEST_TIMEOUT_SECONDS = 30;
    public static final String CONTENT_TYPE_JSON = "application/json";

    // ==================== Auth Types ====================

    public static final String AUTH_TYPE_NONE = "none";
    public static final String AUTH_TYPE_BASIC = "basic";
    public static final String AUTH_TYPE_BEARER = "bearer";

    // ==================== Helper Methods ====================

    /**
     * Gets a configuration value from system property or environment variable.
     *
     * @param key The configuration key
     * @param defaultValue The default value if not found
     * @return The configuration value
     */
    public static String getConfig(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            value = System.getenv(key);
        }
        return (value != null && !value.trim().isEmpty()) ? value.trim() : defaultValue;
    }

    public static boolean getBooleanConfig(String key, boolean defaultValue) {
        String value = getConfig(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value);
    }

    /**
     * Gets an integer configuration value. Unparseable or negative values fall back to the default.
     */
    public static int getIntConfig(String key, int defaultValue) {
        String value = getConfig(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            return parsed < 0 ? defaultValue : parsed;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static String getDbFile() {
        return getConfig(AUDIT_DB_FILE, DEFAULT_DB_FILE);
    }

    public static String getBlobRoot() {
        return getConfig(AUDIT_BLOB_ROOT, DEFAULT_BLOB_ROOT);
    }

    public static boolean isSiemEnabled() {
        return getBooleanConfig(AUDIT_SIEM_ENABLED, DEFAULT_SIEM_ENABLED);
    }

    public static String getSiemUrl() {
        return getConfig(AUDIT_SIEM_URL, DEFAULT_SIEM_URL);
    }

    /**
     * @return The auth type (none, basic, bearer)
     */
    public static String getAuthType() {
        return getConfig(AUDIT_SIEM_AUTH_TYPE, DEFAULT_AUTH_TYPE).toLowerCase();
    }

    public static int getStorageTimeoutSeconds() {
        int seconds = getIntConfig(AUDIT_STORAGE_TIMEOUT_SECONDS, DEFAULT_STORAGE_TIMEOUT_SECONDS);
        return seconds == 0 ? DEFAULT_STORAGE_TIMEOUT_SECONDS : seconds;
    }

    /**
     * SIEM request timeout: the HTTP request timeout, capped at the storage timeout so that a
     * request never outlives the write it belongs to.
     */
    public static int getSiemRequestTimeoutSeconds() {
        return Math.min(REQUEST_TIMEOUT_SECONDS, getStorageTimeoutSeconds());
    }

    /**
     * Gets the quorum policy. Unknown names fall back to {@link QuorumPolicy#NONE}.
     */
    public static QuorumPolicy getQuorumPolicy() {
        return QuorumPolicy.fromConfigValue(getConfig(AUDIT_STORAGE_QUORUM, DEFAULT_STORAGE_QUORUM));
    }

    public static int getAnchorInterval() {
        return getIntConfig(AUDIT_ANCHOR_INTERVAL, DEFAULT_ANCHOR_INTERVAL);
    }

    /**
     * @return The anchor HMAC secret, or null when anchoring is not configured
     */
    public static String getAnchorKey() {
        return getConfig(AUDIT_ANCHOR_KEY, null);
    }

    public static boolean isDebugEnabled() {
        return getBooleanConfig(AUDIT_DEBUG_ENABLED, DEFAULT_DEBUG_ENABLED);
    }
}
