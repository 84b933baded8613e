package quest.gekko.searchvolume.service.core.model;

import quest.gekko.searchvolume.domain.Capability;

import java.util.List;

/**
 * A validated batch query. Keyword ids are unique and kept in request order.
 */
public record SearchVolumeQuery(long userId, List<Long> keywordIds, Capability timing, DateRange range) {

    public SearchVolumeQuery {
        keywordIds = List.copyOf(keywordIds);
    }
}
