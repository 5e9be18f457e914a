package io.github.notecal.ingestion.domain.model;

import lombok.Builder;

import java.util.Objects;

@Builder
public record Task(
        String summary,
        String priority,
        ExplicitDue explicitDue,
        String suggestedDateTime,
        String suggestedDuration,
        String sourceLine,
        Integer lineNumber
) {
    public Task {
        Objects.requireNonNull(summary, "summary");
        if (summary.isBlank()) {
            throw new IllegalArgumentException("O resumo da tarefa não pode ser vazio.");
        }
        explicitDue = explicitDue == null ? ExplicitDue.absent() : explicitDue;
    }
}
