package quest.gekko.searchvolume.service.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Merged subscription intervals of one keyword, kept apart per capability.
 * Each list is sorted by start date and no two of its members overlap or touch.
 */
public record MergedCoverage(long keywordId, List<MergedInterval> hourly, List<MergedInterval> daily) {

    public MergedCoverage {
        hourly = List.copyOf(hourly);
        daily = List.copyOf(daily);
    }

    public static MergedCoverage empty(final long keywordId) {
        return new MergedCoverage(keywordId, List.of(), List.of());
    }

    public List<MergedInterval> all() {
        List<MergedInterval> all = new ArrayList<>(hourly);
        all.addAll(daily);
        return all;
    }

    public boolean isEmpty() {
        return hourly.isEmpty() && daily.isEmpty();
    }
}
