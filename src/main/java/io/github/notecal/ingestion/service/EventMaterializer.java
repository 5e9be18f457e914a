package io.github.notecal.ingestion.service;

import io.github.notecal.ingestion.domain.model.ScheduledWindow;

public interface EventMaterializer {

    /**
     * Cria o evento na agenda. Nunca lança exceção; falhas retornam {@code false}.
     */
    boolean createEvent(String summary, String description, ScheduledWindow window, String timezone);
}
