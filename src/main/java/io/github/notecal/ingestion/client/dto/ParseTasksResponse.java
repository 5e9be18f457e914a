package io.github.notecal.ingestion.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

public record ParseTasksResponse(
        List<ParsedTaskItem> tasks
) {
    public record ParsedTaskItem(
            String task,
            String priority,
            @JsonProperty("due_date") String dueDate,
            @JsonProperty("suggested_time_of_day") String suggestedTimeOfDay,
            @JsonProperty("suggested_duration") String suggestedDuration,
            @JsonProperty("source_line") String sourceLine,
            @JsonProperty("line_number") Integer lineNumber
    ) {}

    public List<ParsedTaskItem> getTasksSafe() {
        return tasks == null ? Collections.emptyList() : tasks;
    }
}
