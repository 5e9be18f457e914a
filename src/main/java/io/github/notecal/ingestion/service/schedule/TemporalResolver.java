package io.github.notecal.ingestion.service.schedule;

import io.github.notecal.ingestion.audit.Log;
import io.github.notecal.ingestion.domain.model.ResolutionBranch;
import io.github.notecal.ingestion.domain.model.ScheduledWindow;
import io.github.notecal.ingestion.domain.model.Task;
import io.github.notecal.ingestion.domain.model.TemporalResolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Resolve os sinais de data/hora de uma tarefa em uma única janela de agenda.
 * <p>
 * Ordem de prioridade: data/hora explícita, data explícita refinada pelo horário sugerido,
 * data explícita como dia inteiro, data/hora sugerida e, por fim, o horário padrão
 * (hoje, ou amanhã depois do horário de corte).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemporalResolver {

    public static final int DEFAULT_DAY_START_HOUR = 9;
    public static final int DEFAULT_EVENING_CUTOFF_HOUR = 17;

    private static final Duration DEFAULT_SLOT_DURATION = Duration.ofHours(1);

    private final DurationParser durationParser;

    public TemporalResolution resolve(Task task, LocalDateTime now) {
        return resolve(task, now, DEFAULT_DAY_START_HOUR, DEFAULT_EVENING_CUTOFF_HOUR);
    }

    public TemporalResolution resolve(Task task, LocalDateTime now, int defaultDayStartHour, int eveningCutoffHour) {
        String rawSuggestion = task.suggestedDateTime();
        boolean suggestionPresent = rawSuggestion != null && !rawSuggestion.isBlank();
        Optional<LocalDateTime> suggestion = suggestionPresent
                ? IsoDateTimes.parseDateTime(rawSuggestion)
                : Optional.empty();
        boolean malformed = suggestionPresent && suggestion.isEmpty();

        // o horário sugerido inválido só conta quando a regra aplicada dependia dele
        return task.explicitDue().match(
                () -> suggestion
                        .map(start -> timed(start, task, ResolutionBranch.SUGGESTED_DATE_TIME))
                        .orElseGet(() -> defaultSlot(task, now, defaultDayStartHour, eveningCutoffHour, malformed)),
                date -> suggestion
                        .map(s -> timed(LocalDateTime.of(date, s.toLocalTime()), task,
                                ResolutionBranch.EXPLICIT_DATE_SUGGESTED_TIME))
                        .orElseGet(() -> allDay(date, task, malformed)),
                dateTime -> {
                    if (malformed) {
                        log.debug("Horário sugerido '{}' ignorado: tarefa '{}' já tem data e hora explícitas.",
                                rawSuggestion, task.summary());
                    }
                    return timed(dateTime, task, ResolutionBranch.EXPLICIT_DATE_TIME);
                }
        );
    }

    private TemporalResolution timed(LocalDateTime start, Task task, ResolutionBranch branch) {
        Duration duration = durationParser.parse(task.suggestedDuration());
        return new TemporalResolution(ScheduledWindow.timed(start, duration), branch, false);
    }

    private TemporalResolution allDay(LocalDate date, Task task, boolean malformed) {
        if (malformed) {
            warnMalformed(task, ResolutionBranch.EXPLICIT_DATE_ALL_DAY);
        }
        return new TemporalResolution(ScheduledWindow.allDay(date), ResolutionBranch.EXPLICIT_DATE_ALL_DAY, malformed);
    }

    private TemporalResolution defaultSlot(Task task, LocalDateTime now, int dayStartHour, int cutoffHour,
                                           boolean malformed) {
        LocalDate eventDate = now.getHour() < cutoffHour ? now.toLocalDate() : now.toLocalDate().plusDays(1);
        LocalDateTime start = LocalDateTime.of(eventDate, LocalTime.of(dayStartHour, 0));

        if (malformed) {
            warnMalformed(task, ResolutionBranch.DEFAULT_SLOT);
        } else {
            log.info("Tarefa '{}' sem data explícita nem horário sugerido. Usando horário padrão {}.",
                    task.summary(), start);
        }
        return new TemporalResolution(
                ScheduledWindow.timed(start, DEFAULT_SLOT_DURATION), ResolutionBranch.DEFAULT_SLOT, malformed);
    }

    private void warnMalformed(Task task, ResolutionBranch fallback) {
        Log.warn(log, "SUGGESTED_TIME_MALFORMED",
                "Horário sugerido '{}' da tarefa '{}' não está em formato ISO-8601. Aplicando {}.",
                task.suggestedDateTime(), task.summary(), fallback);
    }
}
