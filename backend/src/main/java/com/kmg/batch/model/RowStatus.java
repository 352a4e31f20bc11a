package com.kmg.batch.model;

public enum RowStatus {
    COMPLETED("Completed"),
    MISSING("Missing");

    private final String label;

    RowStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
