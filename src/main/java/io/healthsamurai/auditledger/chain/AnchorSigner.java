package io.healthsamurai.auditledger.chain;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Signs and verifies {@link ChainAnchor}s and daily digests with HMAC-SHA256.
 */
public class AnchorSigner {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public AnchorSigner(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Anchor secret must not be empty");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    public ChainAnchor createAnchor(long sequenceNumber, String recordHash, Instant createdAt) {
        return new ChainAnchor(sequenceNumber, recordHash, sign(anchorPayload(sequenceNumber, recordHash)), createdAt);
    }

    /**
     * @return true if the anchor's signature matches its sequence number and hash under this key
     */
    public boolean verify(ChainAnchor anchor) {
        return verify(anchorPayload(anchor.sequenceNumber(), anchor.recordHash()), anchor.signature());
    }

    /**
     * @return true if {@code signature} is this key's signature of {@code payload}
     */
    public boolean verify(String payload, String signature) {
        if (payload == null || signature == null) {
            return false;
        }
        return MessageDigest.isEqual(
                sign(payload).getBytes(StandardCharsets.UTF_8),
                signature.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return Lowercase hex HMAC-SHA256 of the UTF-8 payload
     */
    public String sign(String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            byte[] signature = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(signature);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Cannot compute anchor signature", e);
        }
    }

    private static String anchorPayload(long sequenceNumber, String recordHash) {
        return sequenceNumber + "|" + recordHash;
    }
}
