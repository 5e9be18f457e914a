package io.github.notecal.ingestion.domain.model;

/**
 * Janela resolvida para uma tarefa, com a regra que a produziu.
 * {@code suggestionMalformed} indica que havia um horário sugerido, mas ilegível.
 */
public record TemporalResolution(
        ScheduledWindow window,
        ResolutionBranch branch,
        boolean suggestionMalformed
) {
    public boolean needsReview() {
        return suggestionMalformed;
    }
}
