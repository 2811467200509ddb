package com.encarbot.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed taxonomy of closure evidence. Stored by label in {@code listings.closure_type}.
 */
public enum ClosureReason {
    CONFIRMED_MESSAGE("confirmed-message"),
    ERROR_PAGE("error-page"),
    ERROR_ELEMENT("error-element"),
    REDIRECT_ERROR("redirect-error"),
    HTTP_404("http-404"),
    NO_RESPONSE("no-response");

    private final String label;

    ClosureReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<ClosureReason> fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return Optional.empty();
        }
        String target = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ClosureReason reason : values()) {
            if (reason.label.equals(target)) {
                return Optional.of(reason);
            }
        }
        return Optional.empty();
    }
}
