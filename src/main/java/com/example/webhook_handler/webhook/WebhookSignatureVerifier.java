package com.example.webhook_handler.webhook;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

import com.example.webhook_handler.webhook.SignatureVerificationException.Reason;

/**
 * Webhook署名検証。
 * HMAC-SHA256 で生のリクエストボディの整合性を検証する。
 */
@Component
public class WebhookSignatureVerifier {

    public static final String SIGNATURE_PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    /**
     * Verify that {@code claimedSignature} is the HMAC-SHA256 of {@code payload} keyed by {@code secret}.
     *
     * @param secret           shared secret bytes
     * @param payload          raw request body, exactly as received
     * @param claimedSignature X-Hub-Signature-256 header value, {@code sha256=<hex>}
     * @throws SignatureVerificationException if the signature is malformed or does not match
     */
    public void verify(byte[] secret, byte[] payload, String claimedSignature) {
        byte[] provided = decode(claimedSignature);
        byte[] expected = hmac(secret, payload);

        // MessageDigest.isEqual is constant time for equal-length inputs
        if (!MessageDigest.isEqual(expected, provided)) {
            throw new SignatureVerificationException(Reason.DIGEST_MISMATCH, "signature does not match payload");
        }
    }

    static byte[] decode(String claimedSignature) {
        if (claimedSignature == null || !StandardCharsets.US_ASCII.newEncoder().canEncode(claimedSignature)) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE_ENCODING,
                    "signature is not ASCII text");
        }
        if (claimedSignature.length() < SIGNATURE_PREFIX.length()) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE_ENCODING,
                    "signature is shorter than the " + SIGNATURE_PREFIX + " prefix");
        }
        if (!claimedSignature.startsWith(SIGNATURE_PREFIX)) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE_ENCODING,
                    "signature does not start with " + SIGNATURE_PREFIX);
        }

        String hex = claimedSignature.substring(SIGNATURE_PREFIX.length());
        try {
            return HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new SignatureVerificationException(Reason.INVALID_HEX_ENCODING,
                    "signature is not valid hexadecimal: " + e.getMessage(), e);
        }
    }

    private static byte[] hmac(byte[] secret, byte[] payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            // HMAC accepts any key length but SecretKeySpec rejects an empty one
            byte[] key = secret.length == 0 ? new byte[1] : secret;
            mac.init(new SecretKeySpec(key, ALGORITHM));
            return mac.doFinal(payload);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Unable to compute HMAC", e);
        }
    }
}
