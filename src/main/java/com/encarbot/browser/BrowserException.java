package com.encarbot.browser;

/**
 * A rendering attempt that did not produce a page: launch failure, navigation timeout,
 * crashed target.
 */
public final class BrowserException extends Exception {
    public BrowserException(String message, Throwable cause) {
        super(message, cause);
    }

    public BrowserException(String message) {
        super(message);
    }
}
