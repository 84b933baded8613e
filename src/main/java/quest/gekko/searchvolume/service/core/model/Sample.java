package quest.gekko.searchvolume.service.core.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One hourly search volume reading for a keyword.
 */
public record Sample(long keywordId, LocalDateTime timestamp, long volume) {

    public Sample {
        Objects.requireNonNull(timestamp, "timestamp");
        if (volume < 0) {
            throw new IllegalArgumentException("Search volume must not be negative: " + volume);
        }
    }

    public LocalDate date() {
        return timestamp.toLocalDate();
    }
}
