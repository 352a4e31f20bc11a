package com.kmg.batch.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Provider-format request line bound to {@code row_<index>}.
 */
public record EncodedRequest(int index, String customId, ObjectNode payload) {
    public static final String ID_PREFIX = "row_";

    public static String customIdFor(int index) {
        return ID_PREFIX + index;
    }
}
