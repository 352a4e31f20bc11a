package com.kmg.batch.repo;

import java.time.OffsetDateTime;

public final class SqlTime {
    private SqlTime() {
    }

    public static String toText(OffsetDateTime value) {
        return value == null ? null : value.toString();
    }

    public static OffsetDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return OffsetDateTime.parse(value);
    }
}
