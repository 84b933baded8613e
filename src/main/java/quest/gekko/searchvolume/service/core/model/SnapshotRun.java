package quest.gekko.searchvolume.service.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Summary of one derivation pass over a date range.
 */
public record SnapshotRun(LocalDate from, LocalDate to, int keywords, int snapshots, List<Long> failedKeywords) {

    public SnapshotRun {
        failedKeywords = List.copyOf(failedKeywords);
    }
}
