package io.github.notecal.ingestion.domain.model;

import java.util.List;

public record RunSummary(List<ItemOutcome> outcomes) {

    public RunSummary {
        outcomes = List.copyOf(outcomes);
    }

    public long processed() {
        return count(ItemStatus.PROCESSED);
    }

    public long failed() {
        return count(ItemStatus.FAILED);
    }

    public long skipped() {
        return count(ItemStatus.SKIPPED);
    }

    public int eventsCreated() {
        return outcomes.stream().mapToInt(ItemOutcome::eventsCreated).sum();
    }

    private long count(ItemStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }
}
