package quest.gekko.searchvolume.service.core.model;

import quest.gekko.searchvolume.exception.InvalidIntervalException;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Closed range of calendar dates, both ends inclusive.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new InvalidIntervalException(start, end);
        }
    }

    public static DateRange of(final LocalDate start, final LocalDate end) {
        return new DateRange(start, end);
    }

    public boolean contains(final DateRange other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public boolean overlaps(final DateRange other) {
        return !other.start.isAfter(end) && !other.end.isBefore(start);
    }

    /**
     * True when {@code next}, starting no earlier than this range, overlaps it or begins
     * on the day right after it ends.
     */
    public boolean reaches(final DateRange next) {
        return !next.start.isAfter(end.plusDays(1));
    }

    public DateRange extendTo(final LocalDate newEnd) {
        return newEnd.isAfter(end) ? new DateRange(start, newEnd) : this;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
