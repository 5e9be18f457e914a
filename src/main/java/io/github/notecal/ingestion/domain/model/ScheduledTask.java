package io.github.notecal.ingestion.domain.model;

public record ScheduledTask(Task task, TemporalResolution resolution) {

    public ScheduledWindow window() {
        return resolution.window();
    }
}
