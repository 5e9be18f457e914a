package io.github.notecal.ingestion.service.impl;

import io.github.notecal.ingestion.audit.Log;
import io.github.notecal.ingestion.client.TaskParserClient;
import io.github.notecal.ingestion.client.dto.ParseTasksRequest;
import io.github.notecal.ingestion.client.dto.ParseTasksResponse;
import io.github.notecal.ingestion.domain.model.ExplicitDue;
import io.github.notecal.ingestion.domain.model.Task;
import io.github.notecal.ingestion.service.TaskParser;
import io.github.notecal.ingestion.service.schedule.IsoDateTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class LlmTaskParser implements TaskParser {

    private final TaskParserClient taskParserClient;

    @Override
    public List<Task> parseTasks(String text) {
        ParseTasksResponse response = taskParserClient.parseTasks(new ParseTasksRequest(text));
        List<ParseTasksResponse.ParsedTaskItem> items = response != null ? response.getTasksSafe() : List.of();

        List<Task> tasks = new ArrayList<>();
        for (ParseTasksResponse.ParsedTaskItem item : items) {
            if (item.task() == null || item.task().isBlank()) {
                Log.warn(log, "TASK_WITHOUT_SUMMARY", "Tarefa sem resumo descartada (linha '{}').", item.sourceLine());
                continue;
            }
            tasks.add(Task.builder()
                    .summary(item.task().strip())
                    .priority(item.priority())
                    .explicitDue(toExplicitDue(item))
                    .suggestedDateTime(item.suggestedTimeOfDay())
                    .suggestedDuration(item.suggestedDuration())
                    .sourceLine(item.sourceLine())
                    .lineNumber(item.lineNumber())
                    .build());
        }
        return tasks;
    }

    private ExplicitDue toExplicitDue(ParseTasksResponse.ParsedTaskItem item) {
        String dueDate = item.dueDate();
        if (dueDate == null || dueDate.isBlank()) {
            return ExplicitDue.absent();
        }

        String value = dueDate.strip();
        Optional<TemporalAccessor> parsed = IsoDateTimes.parse(value);
        if (parsed.isEmpty()) {
            Log.warn(log, "DUE_DATE_MALFORMED", "Data '{}' da tarefa '{}' é inválida. Tratando como sem data.",
                    value, item.task());
            return ExplicitDue.absent();
        }
        return parsed.get() instanceof LocalDateTime dateTime
                ? ExplicitDue.atDateTime(dateTime)
                : ExplicitDue.onDate((LocalDate) parsed.get());
    }
}
