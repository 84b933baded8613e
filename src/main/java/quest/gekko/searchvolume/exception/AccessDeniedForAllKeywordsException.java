package quest.gekko.searchvolume.exception;

import java.util.List;

/**
 * Thrown when not a single keyword of a batch query is accessible to the user.
 * A batch with at least one granted keyword is never rejected as a whole.
 */
public class AccessDeniedForAllKeywordsException extends RuntimeException {
    private final long userId;
    private final List<Long> keywordIds;

    public AccessDeniedForAllKeywordsException(final long userId, final List<Long> keywordIds) {
        super("User " + userId + " has no access to keywords_id " + keywordIds);
        this.userId = userId;
        this.keywordIds = List.copyOf(keywordIds);
    }

    public long getUserId() {
        return userId;
    }

    public List<Long> getKeywordIds() {
        return keywordIds;
    }
}
