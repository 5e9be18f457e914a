package io.github.notecal.ingestion.domain.event;

import java.time.OffsetDateTime;
import java.util.UUID;

public record NotificationEvent(
        String messageId,
        OffsetDateTime timestamp,
        String triggerType,
        String eventType,
        String runId,
        NotificationPayload payload
) {
    public static NotificationEvent create(String eventType, String runId, NotificationPayload payload) {
        return new NotificationEvent(
                UUID.randomUUID().toString(),
                OffsetDateTime.now(),
                "ingestion_run_completion",
                eventType,
                runId,
                payload
        );
    }
}
