package io.github.notecal.ingestion.client.dto;

public record ExtractTextResponse(String text) { }
