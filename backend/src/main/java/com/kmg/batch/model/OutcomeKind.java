package com.kmg.batch.model;

public enum OutcomeKind {
    CONTENT,
    REFUSAL,
    ERROR
}
