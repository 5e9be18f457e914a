package io.github.notecal.ingestion.service;

import io.github.notecal.ingestion.domain.model.Task;

import java.util.List;

public interface TaskParser {
    List<Task> parseTasks(String text);
}
