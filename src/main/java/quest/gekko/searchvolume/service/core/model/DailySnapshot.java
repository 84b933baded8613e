package quest.gekko.searchvolume.service.core.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * The hourly sample chosen to represent one keyword on one calendar date.
 */
public record DailySnapshot(long keywordId, LocalDate date, LocalDateTime anchorTimestamp, long volume) {
}
