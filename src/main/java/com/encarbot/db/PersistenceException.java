package com.encarbot.db;

public final class PersistenceException extends Exception {
    public enum Kind {
        NOT_FOUND,
        WRITE_FAILED,
        READ_FAILED
    }

    private final Kind kind;

    public PersistenceException(Kind kind, String message, Throwable cause) {
        super(kind + ": " + message, cause);
        this.kind = kind;
    }

    public PersistenceException(Kind kind, String message) {
        this(kind, message, null);
    }

    public Kind kind() {
        return kind;
    }
}
