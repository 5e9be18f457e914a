package io.github.notecal.ingestion.service.impl;

import io.github.notecal.ingestion.client.CalendarServiceClient;
import io.github.notecal.ingestion.client.dto.CreateEventRequest;
import io.github.notecal.ingestion.domain.model.ScheduledWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CalendarEventMaterializerTest {

    @Mock
    private CalendarServiceClient calendarServiceClient;

    private CalendarEventMaterializer materializer;

    @BeforeEach
    void setUp() {
        materializer = new CalendarEventMaterializer(calendarServiceClient);
    }

    @Test
    void timedWindowIsSentAsDateTimes() {
        ScheduledWindow window = ScheduledWindow.timed(LocalDateTime.of(2025, 3, 12, 14, 30), Duration.ofMinutes(45));

        boolean created = materializer.createEvent("Dentist", "Prioridade: High", window, "Europe/Dublin");

        ArgumentCaptor<CreateEventRequest> captor = ArgumentCaptor.forClass(CreateEventRequest.class);
        verify(calendarServiceClient).createEvent(captor.capture());
        CreateEventRequest request = captor.getValue();
        assertThat(created).isTrue();
        assertThat(request.getSummary()).isEqualTo("Dentist");
        assertThat(request.getStartDateTime()).isEqualTo(LocalDateTime.of(2025, 3, 12, 14, 30));
        assertThat(request.getEndDateTime()).isEqualTo(LocalDateTime.of(2025, 3, 12, 15, 15));
        assertThat(request.getStartDate()).isNull();
        assertThat(request.getTimezone()).isEqualTo("Europe/Dublin");
    }

    @Test
    void allDayWindowIsSentAsDates() {
        materializer.createEvent("Pay rent", "", ScheduledWindow.allDay(LocalDate.of(2025, 4, 1)), "Europe/Dublin");

        ArgumentCaptor<CreateEventRequest> captor = ArgumentCaptor.forClass(CreateEventRequest.class);
        verify(calendarServiceClient).createEvent(captor.capture());
        assertThat(captor.getValue().getStartDate()).isEqualTo(LocalDate.of(2025, 4, 1));
        assertThat(captor.getValue().getEndDate()).isEqualTo(LocalDate.of(2025, 4, 2));
        assertThat(captor.getValue().getStartDateTime()).isNull();
    }

    @Test
    void remoteFailureIsReportedAsFalse() {
        doThrow(new IllegalStateException("503")).when(calendarServiceClient).createEvent(any());

        boolean created = materializer.createEvent("Dentist", "",
                ScheduledWindow.allDay(LocalDate.of(2025, 4, 1)), "Europe/Dublin");

        assertThat(created).isFalse();
    }
}
