package com.encarbot.acquisition;

/**
 * Raised when the escalation chain could not produce a search page.
 */
public final class AcquisitionException extends Exception {
    public enum Kind {
        /** Every allowed attempt was used without a usable response. */
        EXHAUSTED,
        /** The upstream answered with a non-retryable client error. */
        REJECTED,
        /** No attempt got an HTTP response at all. */
        NETWORK
    }

    private final Kind kind;
    private final int attempts;

    public AcquisitionException(Kind kind, String message, int attempts, Throwable cause) {
        super(kind.name().toLowerCase(java.util.Locale.ROOT) + ": " + message, cause);
        this.kind = kind;
        this.attempts = attempts;
    }

    public AcquisitionException(Kind kind, String message, int attempts) {
        this(kind, message, attempts, null);
    }

    public Kind kind() {
        return kind;
    }

    public int attempts() {
        return attempts;
    }
}
