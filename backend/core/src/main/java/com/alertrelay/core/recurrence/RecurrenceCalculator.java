package com.alertrelay.core.recurrence;

import com.alertrelay.core.model.RecurrencePattern;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

// Month and year steps clamp to the last valid day of the target month.
public final class RecurrenceCalculator {
    private final ZoneId zone;

    public RecurrenceCalculator() {
        this(ZoneOffset.UTC);
    }

    public RecurrenceCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone is required");
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * @return the next occurrence, or empty when it would fall after the pattern's end date
     * @throws InvalidRecurrenceException if the interval is not positive
     */
    public Optional<Instant> next(Instant date, RecurrencePattern pattern) {
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(pattern, "pattern is required");
        if (pattern.interval() <= 0) {
            throw new InvalidRecurrenceException("Recurrence interval must be positive but was " + pattern.interval());
        }

        ZonedDateTime start = date.atZone(zone);
        ZonedDateTime next = switch (pattern.frequency()) {
            case DAILY -> start.plusDays(pattern.interval());
            case WEEKLY -> start.plusWeeks(pattern.interval());
            case MONTHLY -> start.plusMonths(pattern.interval());
            case YEARLY -> start.plusYears(pattern.interval());
        };
        Instant candidate = next.toInstant();

        if (pattern.endDate() != null && candidate.isAfter(pattern.endDate())) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }
}
