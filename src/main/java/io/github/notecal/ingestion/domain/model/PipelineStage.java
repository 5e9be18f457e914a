package io.github.notecal.ingestion.domain.model;

public enum PipelineStage {
    FETCH_CANDIDATES,
    FILTER_NEW,
    EXTRACT,
    PARSE,
    RESOLVE_ALL,
    MATERIALIZE_ALL,
    COMMIT
}
