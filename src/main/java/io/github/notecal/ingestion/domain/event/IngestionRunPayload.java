package io.github.notecal.ingestion.domain.event;

public record IngestionRunPayload(
        String senderAddress,
        String subjectKeyword,
        Integer maxResults
) { }
