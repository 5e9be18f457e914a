package io.github.notecal.ingestion.domain.model;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

public record ScheduledWindow(
        LocalDateTime start,
        LocalDateTime end,
        boolean allDay
) {
    public ScheduledWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("O fim da janela deve ser posterior ao início: " + start + " / " + end);
        }
        if (allDay && (!start.toLocalTime().equals(LocalTime.MIDNIGHT) || !end.equals(start.plusDays(1)))) {
            throw new IllegalArgumentException("Janela de dia inteiro deve cobrir exatamente um dia a partir da meia-noite: " + start);
        }
    }

    public static ScheduledWindow allDay(LocalDate date) {
        LocalDateTime start = date.atStartOfDay();
        return new ScheduledWindow(start, start.plusDays(1), true);
    }

    public static ScheduledWindow timed(LocalDateTime start, Duration duration) {
        return new ScheduledWindow(start, start.plus(duration), false);
    }
}
