package com.kmg.batch.model;

public record SkippedRecord(int index, String reason) {
}
