package quest.gekko.searchvolume.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.searchvolume.domain.Capability;
import quest.gekko.searchvolume.exception.InvalidIntervalException;
import quest.gekko.searchvolume.service.core.model.DateRange;
import quest.gekko.searchvolume.service.core.model.MergedCoverage;
import quest.gekko.searchvolume.service.core.model.MergedInterval;
import quest.gekko.searchvolume.service.core.model.SubscriptionInterval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes the subscription intervals of a keyword into sorted, non-overlapping
 * intervals, one set per capability. Capabilities are never merged with each other.
 */
@Slf4j
@Component
public class IntervalMerger {

    public MergedCoverage merge(final long keywordId, final Collection<SubscriptionInterval> intervals) {
        Map<Capability, List<DateRange>> byCapability = new EnumMap<>(Capability.class);
        for (Capability c : Capability.values()) {
            byCapability.put(c, new ArrayList<>());
        }

        for (SubscriptionInterval interval : intervals) {
            if (interval.keywordId() != keywordId) {
                throw new IllegalArgumentException("Interval " + interval + " does not belong to keyword " + keywordId);
            }
            try {
                byCapability.get(interval.capability()).add(interval.range());
            } catch (InvalidIntervalException e) {
                log.warn("Skipping subscription of user {} on keyword {}: {}",
                        interval.userId(), keywordId, e.getMessage());
            }
        }

        return new MergedCoverage(keywordId,
                annotate(Capability.HOURLY, union(byCapability.get(Capability.HOURLY))),
                annotate(Capability.DAILY, union(byCapability.get(Capability.DAILY))));
    }

    /**
     * Classic sweep: sort by start, fold every range that overlaps or directly follows the
     * previous one into it. The result is minimal and sorted; applying it twice changes nothing.
     */
    public List<DateRange> union(final Collection<DateRange> ranges) {
        List<DateRange> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparing(DateRange::start).thenComparing(DateRange::end));

        List<DateRange> merged = new ArrayList<>();
        for (DateRange r : sorted) {
            int last = merged.size() - 1;
            if (last >= 0 && merged.get(last).reaches(r)) {
                merged.set(last, merged.get(last).extendTo(r.end()));
            } else {
                merged.add(r);
            }
        }
        return merged;
    }

    private static List<MergedInterval> annotate(final Capability capability, final List<DateRange> ranges) {
        return ranges.stream().map(r -> new MergedInterval(capability, r)).toList();
    }
}
