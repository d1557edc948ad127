package io.healthsamurai.auditledger.chain;

/**
 * One integrity violation found while re-walking the chain.
 *
 * @param sequenceNumber Sequence number of the offending record
 * @param expected What the chain says the value should be
 * @param actual What the stored record holds
 * @param reason Which check failed
 */
public record BrokenLink(long sequenceNumber, String expected, String actual, Reason reason) {

    public enum Reason {
        /** Stored recordHash differs from a fresh digest of the logical fields */
        HASH_MISMATCH,
        /** previousRecordHash differs from the predecessor's recordHash */
        LINK_MISMATCH,
        /** Sequence number does not follow its predecessor by exactly one */
        SEQUENCE_GAP,
        /** A signed anchor disagrees with the stored record, or names a record that is gone */
        ANCHOR_MISMATCH,
        /** A published anchor does not carry a valid signature */
        ANCHOR_SIGNATURE_INVALID
    }
}
