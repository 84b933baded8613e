package quest.gekko.searchvolume.service.seeding;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import quest.gekko.searchvolume.domain.Capability;
import quest.gekko.searchvolume.domain.HourlySearchVolume;
import quest.gekko.searchvolume.domain.Keyword;
import quest.gekko.searchvolume.domain.UserSubscription;
import quest.gekko.searchvolume.repository.HourlySearchVolumeRepository;
import quest.gekko.searchvolume.repository.KeywordRepository;
import quest.gekko.searchvolume.repository.UserSubscriptionRepository;
import quest.gekko.searchvolume.service.core.DailySnapshotService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fills an empty database with ten keywords, three months of hourly volumes and a set of
 * subscriptions exercising overlapping, partial and mixed-capability cases.
 * Some morning samples are dropped so that snapshots fall back to the nearest hour.
 */
@Slf4j
@Service
@Profile("demo")
@RequiredArgsConstructor
public class DemoDataSeeder {
    static final LocalDate FIRST_DAY = LocalDate.of(2025, 1, 1);
    static final LocalDate LAST_DAY = LocalDate.of(2025, 3, 31);

    private static final List<String> KEYWORDS = List.of(
            "floating shelves", "fireplace mantel", "wall shelf", "butcher block countertop",
            "fireplace surround", "work bench", "countertop", "work table",
            "floating shelf", "bed frame"
    );

    private final KeywordRepository keywordRepo;
    private final HourlySearchVolumeRepository hourlyRepo;
    private final UserSubscriptionRepository subscriptionRepo;
    private final DailySnapshotService snapshotService;

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        if (keywordRepo.count() > 0) {
            log.info("Demo data already present, skipping seeding");
            return;
        }

        Random random = new Random(42);
        for (int i = 0; i < KEYWORDS.size(); i++) {
            Keyword k = new Keyword();
            k.setId((long) i + 1);
            k.setName(KEYWORDS.get(i));
            keywordRepo.save(k);
        }

        List<HourlySearchVolume> rows = new ArrayList<>();
        for (long keywordId = 1; keywordId <= KEYWORDS.size(); keywordId++) {
            for (LocalDateTime ts = FIRST_DAY.atStartOfDay(); ts.isBefore(LAST_DAY.plusDays(1).atStartOfDay()); ts = ts.plusHours(1)) {
                if (keywordId <= 3 && missingMorningHour(ts)) continue;
                HourlySearchVolume h = new HourlySearchVolume();
                h.setKeywordId(keywordId);
                h.setCreatedDatetime(ts);
                h.setSearchVolume(100L + random.nextInt(4900));
                rows.add(h);
            }
        }
        hourlyRepo.saveAll(rows);

        subscriptionRepo.saveAll(List.of(
                // overlapping hourly intervals
                subscription(1, 1, Capability.HOURLY, "2025-01-01", "2025-01-10"),
                subscription(1, 1, Capability.HOURLY, "2025-01-07", "2025-01-20"),
                // overlapping daily intervals
                subscription(2, 5, Capability.DAILY, "2025-01-01", "2025-01-12"),
                subscription(2, 5, Capability.DAILY, "2025-01-10", "2025-01-25"),
                // several keywords, one capability each
                subscription(3, 1, Capability.HOURLY, "2025-01-01", "2025-01-10"),
                subscription(3, 2, Capability.HOURLY, "2025-01-03", "2025-01-15"),
                subscription(4, 6, Capability.DAILY, "2025-01-01", "2025-01-10"),
                subscription(4, 7, Capability.DAILY, "2025-01-03", "2025-01-15"),
                subscription(4, 8, Capability.DAILY, "2025-01-05", "2025-01-12"),
                // hourly and daily on the same keyword
                subscription(5, 2, Capability.HOURLY, "2025-01-01", "2025-01-10"),
                subscription(5, 2, Capability.DAILY, "2025-01-04", "2025-01-15"),
                // mixed capabilities over several keywords, adjacent hourly intervals
                subscription(6, 2, Capability.HOURLY, "2025-01-01", "2025-01-12"),
                subscription(6, 3, Capability.DAILY, "2025-01-01", "2025-01-15"),
                subscription(6, 4, Capability.HOURLY, "2025-01-05", "2025-01-10"),
                subscription(6, 4, Capability.HOURLY, "2025-01-11", "2025-01-18")
        ));

        var run = snapshotService.deriveRange(FIRST_DAY, LAST_DAY);
        log.info("Seeded {} keywords, {} hourly samples and {} daily snapshots", KEYWORDS.size(), rows.size(), run.snapshots());
    }

    // every 10th day loses its 08:00-10:00 readings
    private static boolean missingMorningHour(final LocalDateTime ts) {
        return ts.getDayOfYear() % 10 == 0 && ts.getHour() >= 8 && ts.getHour() <= 10;
    }

    private static UserSubscription subscription(final long userId, final long keywordId, final Capability type,
                                                 final String start, final String end) {
        UserSubscription s = new UserSubscription();
        s.setUserId(userId);
        s.setKeywordId(keywordId);
        s.setSubscriptionType(type);
        s.setStartTime(LocalDate.parse(start));
        s.setEndTime(LocalDate.parse(end));
        return s;
    }
}
