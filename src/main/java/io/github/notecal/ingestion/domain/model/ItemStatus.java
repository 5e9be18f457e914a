package io.github.notecal.ingestion.domain.model;

public enum ItemStatus {
    PROCESSED,
    FAILED,
    SKIPPED
}
