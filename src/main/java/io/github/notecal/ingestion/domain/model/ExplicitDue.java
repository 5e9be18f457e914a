package io.github.notecal.ingestion.domain.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Data ou data/hora escrita explicitamente na nota.
 */
public sealed interface ExplicitDue permits ExplicitDue.Absent, ExplicitDue.OnDate, ExplicitDue.AtDateTime {

    <R> R match(Supplier<R> absent, Function<LocalDate, R> onDate, Function<LocalDateTime, R> atDateTime);

    static ExplicitDue absent() {
        return Absent.INSTANCE;
    }

    static ExplicitDue onDate(LocalDate date) {
        return new OnDate(date);
    }

    static ExplicitDue atDateTime(LocalDateTime dateTime) {
        return new AtDateTime(dateTime);
    }

    final class Absent implements ExplicitDue {
        private static final Absent INSTANCE = new Absent();

        private Absent() {
        }

        @Override
        public <R> R match(Supplier<R> absent, Function<LocalDate, R> onDate, Function<LocalDateTime, R> atDateTime) {
            return absent.get();
        }

        @Override
        public String toString() {
            return "Absent";
        }
    }

    record OnDate(LocalDate date) implements ExplicitDue {
        public OnDate {
            Objects.requireNonNull(date, "date");
        }

        @Override
        public <R> R match(Supplier<R> absent, Function<LocalDate, R> onDate, Function<LocalDateTime, R> atDateTime) {
            return onDate.apply(date);
        }
    }

    record AtDateTime(LocalDateTime dateTime) implements ExplicitDue {
        public AtDateTime {
            Objects.requireNonNull(dateTime, "dateTime");
        }

        @Override
        public <R> R match(Supplier<R> absent, Function<LocalDate, R> onDate, Function<LocalDateTime, R> atDateTime) {
            return atDateTime.apply(dateTime);
        }
    }
}
