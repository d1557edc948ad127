package io.healthsamurai.auditledger.model;

/**
 * Per-backend outcome of persisting one record. Each flag can be set once, during the single
 * commit attempt; a flag that was never set reads as {@code false}.
 */
public class StorageLocations {

    private Boolean database;
    private Boolean blobStore;
    private Boolean siem;

    public synchronized boolean isDatabase() {
        return Boolean.TRUE.equals(database);
    }

    public synchronized boolean isBlobStore() {
        return Boolean.TRUE.equals(blobStore);
    }

    public synchronized boolean isSiem() {
        return Boolean.TRUE.equals(siem);
    }

    public synchronized void markDatabase(boolean stored) {
        checkUnset(database, "database");
        database = stored;
    }

    public synchronized void markBlobStore(boolean stored) {
        checkUnset(blobStore, "blobStore");
        blobStore = stored;
    }

    public synchronized void markSiem(boolean stored) {
        checkUnset(siem, "siem");
        siem = stored;
    }

    /**
     * @return number of backends that accepted the write
     */
    public synchronized int successCount() {
        int count = 0;
        if (isDatabase()) count++;
        if (isBlobStore()) count++;
        if (isSiem()) count++;
        return count;
    }

    private static void checkUnset(Boolean current, String backend) {
        if (current != null) {
            throw new IllegalStateException("Storage status for " + backend + " already recorded");
        }
    }

    @Override
    public synchronized String toString() {
        return "{database: " + isDatabase() + ", blobStore: " + isBlobStore() + ", siem: " + isSiem() + "}";
    }
}
