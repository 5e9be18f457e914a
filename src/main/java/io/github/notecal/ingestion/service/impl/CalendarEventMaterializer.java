package io.github.notecal.ingestion.service.impl;

import io.github.notecal.ingestion.audit.Log;
import io.github.notecal.ingestion.client.CalendarServiceClient;
import io.github.notecal.ingestion.client.dto.CreateEventRequest;
import io.github.notecal.ingestion.domain.model.ScheduledWindow;
import io.github.notecal.ingestion.service.EventMaterializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarEventMaterializer implements EventMaterializer {

    private final CalendarServiceClient calendarServiceClient;

    @Override
    public boolean createEvent(String summary, String description, ScheduledWindow window, String timezone) {
        try {
            calendarServiceClient.createEvent(toRequest(summary, description, window, timezone));
            Log.event(log, "CALENDAR_EVENT_CREATED", "Evento '{}' criado: {} -> {}", summary, window.start(), window.end());
            return true;
        } catch (Exception e) {
            Log.error(log, "CALENDAR_EVENT_FAIL", "Falha ao criar evento '" + summary + "' na agenda", e);
            return false;
        }
    }

    private CreateEventRequest toRequest(String summary, String description, ScheduledWindow window, String timezone) {
        CreateEventRequest.CreateEventRequestBuilder builder = CreateEventRequest.builder()
                .summary(summary)
                .description(description)
                .timezone(timezone);

        if (window.allDay()) {
            builder.startDate(window.start().toLocalDate())
                    .endDate(window.end().toLocalDate());
        } else {
            builder.startDateTime(window.start())
                    .endDateTime(window.end());
        }
        return builder.build();
    }
}
