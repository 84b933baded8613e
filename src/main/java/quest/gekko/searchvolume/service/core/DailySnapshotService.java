package quest.gekko.searchvolume.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import quest.gekko.searchvolume.service.core.model.DailySnapshot;
import quest.gekko.searchvolume.service.core.model.Sample;
import quest.gekko.searchvolume.service.core.model.SnapshotRun;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Materializes daily snapshots from stored hourly samples. Each derived date is upserted on
 * its own, so a concurrent reader sees either the old or the new row of that date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailySnapshotService {
    private final SearchVolumeStore store;
    private final SnapshotDeriver deriver;
    private final RetryTemplate snapshotRetryTemplate;

    /**
     * Re-derives every date in {@code [from, to]} that has samples for the keyword.
     *
     * @return number of snapshots written
     */
    public int deriveForKeyword(final long keywordId, final LocalDate from, final LocalDate to) {
        List<Sample> samples = store.readSamples(keywordId, from.atStartOfDay(), to.plusDays(1).atStartOfDay());
        List<DailySnapshot> snapshots = deriver.deriveDaily(keywordId, samples);
        snapshots.forEach(store::upsertDailySnapshot);
        log.debug("Keyword {}: {} snapshots from {} samples between {} and {}", keywordId, snapshots.size(), samples.size(), from, to);
        return snapshots.size();
    }

    /**
     * Derives snapshots for every keyword with samples in the range. A keyword that still fails
     * after retrying is reported in the result and the run moves on.
     */
    public SnapshotRun deriveRange(final LocalDate from, final LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from " + from + " is after to " + to);
        }

        List<Long> keywordIds = store.keywordsWithSamples(from.atStartOfDay(), to.plusDays(1).atStartOfDay());
        List<Long> failed = new ArrayList<>();
        int written = 0;
        for (Long keywordId : keywordIds) {
            try {
                written += snapshotRetryTemplate.execute(ctx -> deriveForKeyword(keywordId, from, to));
            } catch (RuntimeException e) {
                log.error("Daily snapshot derivation failed for keyword {} between {} and {}", keywordId, from, to, e);
                failed.add(keywordId);
            }
        }

        log.info("Derived {} daily snapshots for {} keywords between {} and {} ({} failed)",
                written, keywordIds.size(), from, to, failed.size());
        return new SnapshotRun(from, to, keywordIds.size(), written, failed);
    }
}
