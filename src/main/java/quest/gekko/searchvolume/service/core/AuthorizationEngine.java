package quest.gekko.searchvolume.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.searchvolume.domain.Capability;
import quest.gekko.searchvolume.service.core.model.AuthorizationVerdict;
import quest.gekko.searchvolume.service.core.model.DateRange;
import quest.gekko.searchvolume.service.core.model.DenialReason;
import quest.gekko.searchvolume.service.core.model.MergedCoverage;
import quest.gekko.searchvolume.service.core.model.MergedInterval;

import java.util.List;

/**
 * Decides whether a keyword's merged coverage grants a requested capability over the whole
 * requested range.
 *
 * <p>Coverage is strict: a request that is only partly covered is denied, never clipped to
 * the covered part. Clipping would be added here, by returning a narrower authorized range.
 */
@Component
@RequiredArgsConstructor
public class AuthorizationEngine {
    private final IntervalMerger merger;

    public AuthorizationVerdict evaluate(final MergedCoverage coverage, final Capability requested, final DateRange range) {
        final long keywordId = coverage.keywordId();

        // intervals of any capability implying the requested one, re-merged since
        // HOURLY and DAILY members may overlap or touch each other
        List<DateRange> effective = merger.union(coverage.all().stream()
                .filter(i -> i.grants(requested))
                .map(MergedInterval::range)
                .toList());

        if (coveredBySingle(effective, range)) {
            return AuthorizationVerdict.granted(keywordId, range);
        }
        if (effective.stream().anyMatch(r -> r.overlaps(range))) {
            return AuthorizationVerdict.denied(keywordId, DenialReason.INSUFFICIENT_RANGE);
        }
        // nothing the keyword is subscribed to grants the requested capability, whatever the dates
        boolean onlyOtherCapability = effective.isEmpty() && !coverage.isEmpty();
        boolean otherCapabilityOverlaps = coverage.all().stream()
                .filter(i -> !i.grants(requested))
                .anyMatch(i -> i.range().overlaps(range));
        if (onlyOtherCapability || otherCapabilityOverlaps) {
            return AuthorizationVerdict.denied(keywordId, DenialReason.INSUFFICIENT_CAPABILITY);
        }
        return AuthorizationVerdict.denied(keywordId, DenialReason.NO_SUBSCRIPTION);
    }

    /**
     * Merged ranges are separated by at least one uncovered day, so contiguous coverage of
     * {@code range} means one merged range holds it entirely. Binary search for the last range
     * starting on or before the requested start.
     */
    static boolean coveredBySingle(final List<DateRange> merged, final DateRange range) {
        int lo = 0;
        int hi = merged.size() - 1;
        int candidate = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (merged.get(mid).start().isAfter(range.start())) {
                hi = mid - 1;
            } else {
                candidate = mid;
                lo = mid + 1;
            }
        }
        return candidate >= 0 && merged.get(candidate).contains(range);
    }
}
