package quest.gekko.searchvolume.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.searchvolume.domain.DailySearchVolume;
import quest.gekko.searchvolume.domain.Keyword;
import quest.gekko.searchvolume.service.core.SearchVolumeStore;
import quest.gekko.searchvolume.service.core.model.DailySnapshot;
import quest.gekko.searchvolume.service.core.model.Sample;
import quest.gekko.searchvolume.service.core.model.SubscriptionInterval;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JpaSearchVolumeStore implements SearchVolumeStore {
    public static final String KEYWORD_NAMES_CACHE = "keywordNames";

    private final KeywordRepository keywordRepo;
    private final HourlySearchVolumeRepository hourlyRepo;
    private final DailySearchVolumeRepository dailyRepo;
    private final UserSubscriptionRepository subscriptionRepo;

    @Override
    public List<SubscriptionInterval> listSubscriptions(final long userId, final Collection<Long> keywordIds) {
        if (keywordIds.isEmpty()) return List.of();
        return subscriptionRepo.findByUserIdAndKeywordIdIn(userId, keywordIds).stream()
                .map(s -> new SubscriptionInterval(s.getUserId(), s.getKeywordId(), s.getSubscriptionType(),
                        s.getStartTime(), s.getEndTime()))
                .toList();
    }

    @Override
    public List<Sample> readSamples(final long keywordId, final LocalDateTime from, final LocalDateTime toExclusive) {
        return hourlyRepo.findRange(keywordId, from, toExclusive).stream()
                .map(h -> new Sample(h.getKeywordId(), h.getCreatedDatetime(), h.getSearchVolume()))
                .toList();
    }

    @Override
    public List<DailySnapshot> readDailySnapshots(final long keywordId, final LocalDate from, final LocalDate to) {
        return dailyRepo.findByKeywordIdAndCreatedDateBetweenOrderByCreatedDateAsc(keywordId, from, to).stream()
                .map(d -> new DailySnapshot(d.getKeywordId(), d.getCreatedDate(), d.getAnchorDatetime(), d.getSearchVolume()))
                .toList();
    }

    @Override
    @Transactional
    public void upsertDailySnapshot(final DailySnapshot snapshot) {
        DailySearchVolume row = dailyRepo.findByKeywordIdAndCreatedDate(snapshot.keywordId(), snapshot.date())
                .orElseGet(() -> {
                    DailySearchVolume fresh = new DailySearchVolume();
                    fresh.setKeywordId(snapshot.keywordId());
                    fresh.setCreatedDate(snapshot.date());
                    return fresh;
                });
        row.setAnchorDatetime(snapshot.anchorTimestamp());
        row.setSearchVolume(snapshot.volume());
        dailyRepo.save(row);
    }

    // a miss is not cached so a keyword added later gets its name
    @Override
    @Cacheable(value = KEYWORD_NAMES_CACHE, unless = "#result == null")
    public Optional<String> keywordName(final long keywordId) {
        return keywordRepo.findById(keywordId).map(Keyword::getName);
    }

    @Override
    public List<Long> keywordsWithSamples(final LocalDateTime from, final LocalDateTime toExclusive) {
        return hourlyRepo.findKeywordIdsBetween(from, toExclusive);
    }
}
