package io.github.notecal.ingestion.domain.model;

public enum ResolutionBranch {
    EXPLICIT_DATE_TIME,
    EXPLICIT_DATE_SUGGESTED_TIME,
    EXPLICIT_DATE_ALL_DAY,
    SUGGESTED_DATE_TIME,
    DEFAULT_SLOT
}
