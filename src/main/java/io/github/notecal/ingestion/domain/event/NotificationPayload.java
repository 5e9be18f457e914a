package io.github.notecal.ingestion.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.notecal.ingestion.domain.model.RunSummary;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationPayload(
        String status,
        Long processed,
        Long failed,
        Long skipped,
        Integer eventsCreated,
        String errorCode,
        String errorMessage
) {
    public static NotificationPayload fromSummary(RunSummary summary) {
        String status;
        if (summary.failed() == 0) {
            status = "SUCCESS";
        } else if (summary.processed() > 0) {
            status = "PARTIAL";
        } else {
            status = "FAILED";
        }
        return new NotificationPayload(status, summary.processed(), summary.failed(), summary.skipped(),
                summary.eventsCreated(), null, null);
    }

    public static NotificationPayload error(String errorCode, String errorMessage) {
        return new NotificationPayload("FAILED", null, null, null, null, errorCode, errorMessage);
    }
}
