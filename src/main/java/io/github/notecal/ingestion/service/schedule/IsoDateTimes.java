package io.github.notecal.ingestion.service.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Leitura tolerante de datas ISO-8601 vindas dos serviços de extração.
 * <p>
 * Aceita data pura, data com hora, separador espaço no lugar de {@code T} e offset/{@code Z}.
 * O offset é descartado: vale o horário local escrito.
 */
public final class IsoDateTimes {

    private static final DateTimeFormatter LENIENT_ISO = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withChronology(IsoChronology.INSTANCE)
            .withResolverStyle(ResolverStyle.STRICT);

    private IsoDateTimes() {
    }

    /**
     * @return um {@link LocalDateTime} quando há parte de hora, um {@link LocalDate} quando não há,
     * ou vazio se o texto não é ISO-8601
     */
    public static Optional<TemporalAccessor> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.strip();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }

        try {
            return Optional.of(LENIENT_ISO.parseBest(text, LocalDateTime::from, LocalDate::from));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Como {@link #parse}, mas uma data pura vira meia-noite. */
    public static Optional<LocalDateTime> parseDateTime(String raw) {
        return parse(raw).map(parsed -> parsed instanceof LocalDate date
                ? date.atStartOfDay()
                : (LocalDateTime) parsed);
    }
}
