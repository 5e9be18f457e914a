package io.github.notecal.ingestion.domain.event;

import java.time.OffsetDateTime;

public record IngestionEvent(
        String messageId,
        OffsetDateTime timestamp,
        String triggerType,
        String eventType,
        IngestionRunPayload payload
) { }
