package quest.gekko.searchvolume.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.searchvolume.domain.Capability;
import quest.gekko.searchvolume.exception.AccessDeniedForAllKeywordsException;
import quest.gekko.searchvolume.exception.StorageUnavailableException;
import quest.gekko.searchvolume.service.core.model.AuthorizationVerdict;
import quest.gekko.searchvolume.service.core.model.DateRange;
import quest.gekko.searchvolume.service.core.model.KeywordQueryResult;
import quest.gekko.searchvolume.service.core.model.MergedCoverage;
import quest.gekko.searchvolume.service.core.model.SearchVolumeQuery;
import quest.gekko.searchvolume.service.core.model.SubscriptionInterval;
import quest.gekko.searchvolume.service.core.model.VolumePoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Answers a batch search volume query. Every keyword is authorized and served on its own;
 * a denied keyword turns into an error entry without affecting the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchVolumeQueryService {
    private final SearchVolumeStore store;
    private final IntervalMerger merger;
    private final AuthorizationEngine authorizationEngine;

    /**
     * @throws AccessDeniedForAllKeywordsException if no keyword of the batch is granted
     * @throws StorageUnavailableException if the store fails
     */
    @Transactional(readOnly = true)
    public List<KeywordQueryResult> execute(final SearchVolumeQuery query) {
        try {
            Map<Long, List<SubscriptionInterval>> byKeyword = store.listSubscriptions(query.userId(), query.keywordIds())
                    .stream()
                    .collect(Collectors.groupingBy(SubscriptionInterval::keywordId));

            List<KeywordQueryResult> results = new ArrayList<>(query.keywordIds().size());
            for (Long keywordId : query.keywordIds()) {
                MergedCoverage coverage = merger.merge(keywordId, byKeyword.getOrDefault(keywordId, List.of()));
                AuthorizationVerdict verdict = authorizationEngine.evaluate(coverage, query.timing(), query.range());
                log.debug("User {} keyword {} {} {}: {}", query.userId(), keywordId, query.timing(), query.range(),
                        verdict.granted() ? "granted" : verdict.reason().label());

                List<VolumePoint> data = verdict.granted()
                        ? readVolumes(keywordId, query.timing(), query.range())
                        : List.of();
                results.add(new KeywordQueryResult(keywordId, store.keywordName(keywordId).orElse(null), verdict, data));
            }

            if (results.stream().noneMatch(KeywordQueryResult::granted)) {
                throw new AccessDeniedForAllKeywordsException(query.userId(), query.keywordIds());
            }
            return results;
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Search volume storage is unavailable", e);
        }
    }

    private List<VolumePoint> readVolumes(final long keywordId, final Capability timing, final DateRange range) {
        if (timing == Capability.HOURLY) {
            return store.readSamples(keywordId, range.start().atStartOfDay(), range.end().plusDays(1).atStartOfDay())
                    .stream()
                    .map(s -> new VolumePoint(s.timestamp(), s.volume()))
                    .toList();
        }
        return store.readDailySnapshots(keywordId, range.start(), range.end())
                .stream()
                .map(d -> new VolumePoint(d.date().atStartOfDay(), d.volume()))
                .toList();
    }
}
