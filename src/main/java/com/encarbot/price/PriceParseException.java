package com.encarbot.price;

/**
 * Raised when a price value has no recognizable format.
 */
public final class PriceParseException extends Exception {
    private final String rawValue;

    public PriceParseException(Object rawValue, String message) {
        super("unrecognized_price_format: " + message + " value=" + rawValue);
        this.rawValue = rawValue == null ? null : String.valueOf(rawValue);
    }

    public String rawValue() {
        return rawValue;
    }
}
