package com.kmg.batch.model;

public record ParsedLine(Kind kind, Integer index, Outcome outcome, String detail) {

    public enum Kind {
        OUTCOME,
        UNMATCHED_ID,
        UNDECODABLE,
        BLANK
    }

    public static ParsedLine outcome(int index, Outcome outcome) {
        return new ParsedLine(Kind.OUTCOME, index, outcome, null);
    }

    public static ParsedLine unmatched(String customId) {
        return new ParsedLine(Kind.UNMATCHED_ID, null, null, customId);
    }

    public static ParsedLine undecodable(String reason) {
        return new ParsedLine(Kind.UNDECODABLE, null, null, reason);
    }

    public static ParsedLine blank() {
        return new ParsedLine(Kind.BLANK, null, null, null);
    }
}
