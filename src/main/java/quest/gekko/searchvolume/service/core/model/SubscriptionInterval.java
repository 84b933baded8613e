package quest.gekko.searchvolume.service.core.model;

import quest.gekko.searchvolume.domain.Capability;

import java.time.LocalDate;

/**
 * A stored subscription row as read from storage. Bounds are not validated here;
 * {@link #range()} fails for a start after the end.
 */
public record SubscriptionInterval(long userId, long keywordId, Capability capability,
                                   LocalDate startDate, LocalDate endDate) {

    public DateRange range() {
        return new DateRange(startDate, endDate);
    }
}
