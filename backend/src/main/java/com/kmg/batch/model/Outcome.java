package com.kmg.batch.model;

import java.util.Objects;

/**
 * Parsed per-record result of one result line.
 */
public record Outcome(OutcomeKind kind, String text) {
    public static final String REFUSAL_PREFIX = "[REFUSAL] ";
    public static final String ERROR_PREFIX = "[ERROR] ";

    public Outcome {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text;
    }

    public static Outcome content(String text) {
        return new Outcome(OutcomeKind.CONTENT, text);
    }

    public static Outcome refusal(String text) {
        return new Outcome(OutcomeKind.REFUSAL, text);
    }

    public static Outcome error(String reason) {
        return new Outcome(OutcomeKind.ERROR, reason);
    }

    /**
     * Text stored in the reconciled table; refusals and errors carry a prefix so they can be
     * told apart from genuine content.
     */
    public String responseText() {
        return switch (kind) {
            case CONTENT -> text;
            case REFUSAL -> REFUSAL_PREFIX + text;
            case ERROR -> ERROR_PREFIX + text;
        };
    }
}
