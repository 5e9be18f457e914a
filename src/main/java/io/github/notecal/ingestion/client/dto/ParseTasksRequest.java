package io.github.notecal.ingestion.client.dto;

public record ParseTasksRequest(String text) { }
