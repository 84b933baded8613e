package quest.gekko.searchvolume.service.core;

import quest.gekko.searchvolume.service.core.model.DailySnapshot;
import quest.gekko.searchvolume.service.core.model.Sample;
import quest.gekko.searchvolume.service.core.model.SubscriptionInterval;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable state shared by the query path and the snapshot job. Implementations report
 * failures as {@link org.springframework.dao.DataAccessException}.
 */
public interface SearchVolumeStore {

    List<SubscriptionInterval> listSubscriptions(long userId, Collection<Long> keywordIds);

    /**
     * @return samples with {@code from <= timestamp < toExclusive}, oldest first
     */
    List<Sample> readSamples(long keywordId, LocalDateTime from, LocalDateTime toExclusive);

    /**
     * @return snapshots dated within {@code [from, to]}, oldest first
     */
    List<DailySnapshot> readDailySnapshots(long keywordId, LocalDate from, LocalDate to);

    void upsertDailySnapshot(DailySnapshot snapshot);

    Optional<String> keywordName(long keywordId);

    List<Long> keywordsWithSamples(LocalDateTime from, LocalDateTime toExclusive);
}
