package io.github.notecal.ingestion.domain.model;

public record AttachmentRef(String filename, String objectKey) { }
