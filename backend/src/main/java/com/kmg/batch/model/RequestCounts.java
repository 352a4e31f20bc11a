package com.kmg.batch.model;

public record RequestCounts(int total, int completed, int failed) {
    public static final RequestCounts EMPTY = new RequestCounts(0, 0, 0);
}
