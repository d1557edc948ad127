package io.healthsamurai.auditledger.chain;

import java.time.Instant;

/**
 * Keyed signature over a chain position, published outside the record database so that a
 * rewritten chain no longer matches its anchors.
 */
public record ChainAnchor(long sequenceNumber, String recordHash, String signature, Instant createdAt) {}
