package com.latchkey.backend.modules.auth.application;

/**
 * Raised by {@link SignedTokenCodec#verify}. The reason stays internal; callers collapse every
 * reason into one generic invalid-or-expired signal.
 */
public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        TAMPERED_OR_MALFORMED,
        WRONG_PURPOSE,
        EXPIRED
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason, String message) {
        this(reason, message, null);
    }

    public TokenVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
