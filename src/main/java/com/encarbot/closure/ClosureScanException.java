package com.encarbot.closure;

public final class ClosureScanException extends Exception {
    public enum Kind {
        NAVIGATION_FAILED,
        UPSTREAM_STATUS
    }

    private final Kind kind;
    private final String listingId;

    public ClosureScanException(Kind kind, String listingId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.listingId = listingId;
    }

    public Kind kind() {
        return kind;
    }

    public String listingId() {
        return listingId;
    }
}
