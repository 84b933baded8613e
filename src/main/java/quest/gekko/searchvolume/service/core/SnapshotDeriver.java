package quest.gekko.searchvolume.service.core;

import quest.gekko.searchvolume.service.core.model.DailySnapshot;
import quest.gekko.searchvolume.service.core.model.Sample;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Collapses the hourly samples of a keyword into one snapshot per calendar date.
 *
 * <p>For each date the sample closest to the anchor time of that date is kept. Two samples
 * equally far from the anchor resolve to the earlier one, so the choice never depends on
 * the order samples arrive in. Timestamps and anchor are compared as wall-clock values;
 * no zone conversion happens here.
 */
public class SnapshotDeriver {
    public static final LocalTime DEFAULT_ANCHOR = LocalTime.of(9, 0);

    private final LocalTime anchorTime;

    public SnapshotDeriver(final LocalTime anchorTime) {
        this.anchorTime = Objects.requireNonNull(anchorTime, "anchorTime");
    }

    public SnapshotDeriver() {
        this(DEFAULT_ANCHOR);
    }

    public LocalDateTime anchorOf(final LocalDate date) {
        return date.atTime(anchorTime);
    }

    /**
     * Picks the representative sample of {@code date}.
     *
     * @return empty when there is no sample for the date
     * @throws IllegalArgumentException if a sample belongs to another keyword or date
     */
    public Optional<DailySnapshot> derive(final long keywordId, final LocalDate date, final Collection<Sample> samples) {
        for (Sample s : samples) {
            if (s.keywordId() != keywordId || !s.date().equals(date)) {
                throw new IllegalArgumentException("Sample " + s + " does not belong to keyword " + keywordId + " on " + date);
            }
        }

        LocalDateTime anchor = anchorOf(date);
        Comparator<Sample> closestFirst = Comparator
                .comparingLong((Sample s) -> Math.abs(Duration.between(anchor, s.timestamp()).getSeconds()))
                .thenComparing(Sample::timestamp);

        return samples.stream()
                .min(closestFirst)
                .map(s -> new DailySnapshot(keywordId, date, s.timestamp(), s.volume()));
    }

    /**
     * Derives one snapshot for every date that has at least one sample, ordered by date.
     */
    public List<DailySnapshot> deriveDaily(final long keywordId, final Collection<Sample> samples) {
        Map<LocalDate, List<Sample>> byDate = new TreeMap<>();
        for (Sample s : samples) {
            byDate.computeIfAbsent(s.date(), d -> new ArrayList<>()).add(s);
        }

        List<DailySnapshot> snapshots = new ArrayList<>(byDate.size());
        byDate.forEach((date, daySamples) -> derive(keywordId, date, daySamples).ifPresent(snapshots::add));
        return snapshots;
    }
}
