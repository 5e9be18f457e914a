package io.github.notecal.ingestion.client;

import io.github.notecal.ingestion.client.dto.ParseTasksRequest;
import io.github.notecal.ingestion.client.dto.ParseTasksResponse;
import io.github.notecal.ingestion.config.InternalApiFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "task-parser",
        url = "${app.services.task-parser-url}",
        configuration = InternalApiFeignConfig.class
)
public interface TaskParserClient {
    @PostMapping("/api/internal/tasks/parse")
    ParseTasksResponse parseTasks(@RequestBody ParseTasksRequest request);
}
