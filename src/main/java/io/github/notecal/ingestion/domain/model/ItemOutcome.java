package io.github.notecal.ingestion.domain.model;

public record ItemOutcome(
        String itemId,
        ItemStatus status,
        String reason,
        int eventsCreated
) {
    public static final String NO_TASKS = "NO_TASKS";
    public static final String ALREADY_PROCESSED = "ALREADY_PROCESSED";

    public static ItemOutcome processed(String itemId, int eventsCreated) {
        return new ItemOutcome(itemId, ItemStatus.PROCESSED, null, eventsCreated);
    }

    public static ItemOutcome failed(String itemId, String reason, int eventsCreated) {
        return new ItemOutcome(itemId, ItemStatus.FAILED, reason, eventsCreated);
    }

    public static ItemOutcome skipped(String itemId) {
        return new ItemOutcome(itemId, ItemStatus.SKIPPED, ALREADY_PROCESSED, 0);
    }
}
