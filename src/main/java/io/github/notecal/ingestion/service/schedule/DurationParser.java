package io.github.notecal.ingestion.service.schedule;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class DurationParser {

    public static final Duration DEFAULT_DURATION = Duration.ofHours(1);

    private static final Pattern QUANTITY_PATTERN =
            Pattern.compile("^(\\d{1,5})\\s*(minutes|minute|mins|min|hours|hour|hrs|hr|h)");

    public Duration parse(String text) {
        if (text == null || text.isBlank()) {
            return DEFAULT_DURATION;
        }

        String normalized = text.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = QUANTITY_PATTERN.matcher(normalized);
        if (matcher.find()) {
            return toDuration(matcher.group(1), matcher.group(2));
        }

        // "flexible" e qualquer outro texto caem no padrão
        return DEFAULT_DURATION;
    }

    private Duration toDuration(String quantity, String unit) {
        long value = Long.parseLong(quantity);
        if (value == 0) {
            return DEFAULT_DURATION;
        }
        return unit.startsWith("m") ? Duration.ofMinutes(value) : Duration.ofHours(value);
    }
}
