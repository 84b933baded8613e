package quest.gekko.searchvolume.service.core.model;

import java.util.Optional;

/**
 * Outcome of evaluating one keyword of a request. A granted verdict always carries the
 * requested range unchanged as its authorized range.
 */
public record AuthorizationVerdict(long keywordId, boolean granted, DenialReason reason, DateRange authorizedRange) {

    public static AuthorizationVerdict granted(final long keywordId, final DateRange range) {
        return new AuthorizationVerdict(keywordId, true, null, range);
    }

    public static AuthorizationVerdict denied(final long keywordId, final DenialReason reason) {
        return new AuthorizationVerdict(keywordId, false, reason, null);
    }

    public Optional<DenialReason> denialReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<DateRange> authorized() {
        return Optional.ofNullable(authorizedRange);
    }
}
