package io.github.notecal.ingestion.client;

import io.github.notecal.ingestion.client.dto.CreateEventRequest;
import io.github.notecal.ingestion.config.InternalApiFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "calendar-service",
        url = "${app.services.calendar-url}",
        configuration = InternalApiFeignConfig.class
)
public interface CalendarServiceClient {
    @PostMapping("/api/internal/events")
    void createEvent(@RequestBody CreateEventRequest request);
}
