package com.example.webhook_handler.webhook;

/**
 * Raised when a claimed signature does not authenticate the payload.
 * The reason is for server-side logs only; callers see a single 401.
 */
public class SignatureVerificationException extends RuntimeException {

    public enum Reason {
        /** Header is not ASCII text, or too short / wrongly prefixed. */
        MALFORMED_SIGNATURE_ENCODING,
        /** Digest after the prefix is not valid hexadecimal. */
        INVALID_HEX_ENCODING,
        /** Digest decoded but does not match the expected HMAC. */
        DIGEST_MISMATCH
    }

    private final Reason reason;

    public SignatureVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SignatureVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
