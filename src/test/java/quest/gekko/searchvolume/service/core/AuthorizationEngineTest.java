package quest.gekko.searchvolume.service.core;

import org.junit.jupiter.api.Test;
import quest.gekko.searchvolume.domain.Capability;
import quest.gekko.searchvolume.service.core.model.AuthorizationVerdict;
import quest.gekko.searchvolume.service.core.model.DateRange;
import quest.gekko.searchvolume.service.core.model.DenialReason;
import quest.gekko.searchvolume.service.core.model.MergedCoverage;
import quest.gekko.searchvolume.service.core.model.SubscriptionInterval;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AuthorizationEngineTest {
    private final IntervalMerger merger = new IntervalMerger();
    private final AuthorizationEngine engine = new AuthorizationEngine(merger);

    private static DateRange jan(int from, int to) {
        return DateRange.of(LocalDate.of(2025, 1, from), LocalDate.of(2025, 1, to));
    }

    private static SubscriptionInterval sub(Capability capability, DateRange range) {
        return new SubscriptionInterval(1L, 42L, capability, range.start(), range.end());
    }

    private MergedCoverage coverage(SubscriptionInterval... intervals) {
        return merger.merge(42L, Arrays.asList(intervals));
    }

    @Test
    void hourlySubscriptionGrantsDailyRequests() {
        AuthorizationVerdict verdict = engine.evaluate(coverage(sub(Capability.HOURLY, jan(1, 31))), Capability.DAILY, jan(10, 20));

        assertThat(verdict.granted()).isTrue();
        assertThat(verdict.authorizedRange()).isEqualTo(jan(10, 20));
        assertThat(verdict.denialReason()).isEmpty();
    }

    @Test
    void dailySubscriptionDoesNotGrantHourlyRequests() {
        AuthorizationVerdict verdict = engine.evaluate(coverage(sub(Capability.DAILY, jan(1, 31))), Capability.HOURLY, jan(10, 20));

        assertThat(verdict.granted()).isFalse();
        assertThat(verdict.reason()).isEqualTo(DenialReason.INSUFFICIENT_CAPABILITY);
        assertThat(verdict.authorized()).isEmpty();
    }

    @Test
    void dailyOnlyKeywordLacksCapabilityEvenOutsideItsDates() {
        MergedCoverage coverage = coverage(sub(Capability.DAILY, jan(1, 31)));
        DateRange february = DateRange.of(LocalDate.of(2025, 2, 1), LocalDate.of(2025, 2, 3));

        assertThat(engine.evaluate(coverage, Capability.HOURLY, february).reason()).isEqualTo(DenialReason.INSUFFICIENT_CAPABILITY);
        assertThat(engine.evaluate(coverage, Capability.DAILY, february).reason()).isEqualTo(DenialReason.NO_SUBSCRIPTION);
    }

    @Test
    void mixedCoverageOutsideAllDatesHasNoSubscription() {
        MergedCoverage coverage = coverage(sub(Capability.HOURLY, jan(1, 5)), sub(Capability.DAILY, jan(10, 15)));

        assertThat(engine.evaluate(coverage, Capability.HOURLY, jan(20, 25)).reason()).isEqualTo(DenialReason.NO_SUBSCRIPTION);
    }

    @Test
    void partialCoverageIsDeniedNotClipped() {
        AuthorizationVerdict verdict = engine.evaluate(coverage(sub(Capability.DAILY, jan(5, 15))), Capability.DAILY, jan(1, 10));

        assertThat(verdict.granted()).isFalse();
        assertThat(verdict.reason()).isEqualTo(DenialReason.INSUFFICIENT_RANGE);
    }

    @Test
    void requestOutsideAllIntervalsHasNoSubscription() {
        AuthorizationVerdict verdict = engine.evaluate(coverage(sub(Capability.HOURLY, jan(1, 5))), Capability.HOURLY, jan(10, 12));

        assertThat(verdict.reason()).isEqualTo(DenialReason.NO_SUBSCRIPTION);
    }

    @Test
    void keywordWithoutIntervalsHasNoSubscription() {
        AuthorizationVerdict verdict = engine.evaluate(MergedCoverage.empty(42L), Capability.DAILY, jan(1, 1));

        assertThat(verdict.keywordId()).isEqualTo(42L);
        assertThat(verdict.reason()).isEqualTo(DenialReason.NO_SUBSCRIPTION);
    }

    @Test
    void overlappingIntervalsGrantTheirUnion() {
        MergedCoverage coverage = coverage(sub(Capability.HOURLY, jan(1, 10)), sub(Capability.HOURLY, jan(7, 20)));

        assertThat(engine.evaluate(coverage, Capability.HOURLY, jan(2, 18)).granted()).isTrue();
        assertThat(engine.evaluate(coverage, Capability.HOURLY, jan(1, 21)).reason()).isEqualTo(DenialReason.INSUFFICIENT_RANGE);
    }

    @Test
    void adjacentIntervalsCoverContinuously() {
        MergedCoverage coverage = coverage(sub(Capability.HOURLY, jan(5, 10)), sub(Capability.HOURLY, jan(11, 18)));

        assertThat(engine.evaluate(coverage, Capability.HOURLY, jan(5, 18)).granted()).isTrue();
    }

    @Test
    void gapBetweenIntervalsBreaksCoverage() {
        MergedCoverage coverage = coverage(sub(Capability.DAILY, jan(1, 5)), sub(Capability.DAILY, jan(7, 10)));

        AuthorizationVerdict verdict = engine.evaluate(coverage, Capability.DAILY, jan(3, 8));

        assertThat(verdict.reason()).isEqualTo(DenialReason.INSUFFICIENT_RANGE);
    }

    @Test
    void hourlyAndDailyIntervalsJoinForDailyRequests() {
        MergedCoverage coverage = coverage(sub(Capability.HOURLY, jan(1, 10)), sub(Capability.DAILY, jan(11, 15)));

        assertThat(engine.evaluate(coverage, Capability.DAILY, jan(1, 15)).granted()).isTrue();
        assertThat(engine.evaluate(coverage, Capability.HOURLY, jan(1, 15)).reason()).isEqualTo(DenialReason.INSUFFICIENT_RANGE);
        assertThat(engine.evaluate(coverage, Capability.HOURLY, jan(12, 14)).reason()).isEqualTo(DenialReason.INSUFFICIENT_CAPABILITY);
    }

    @Test
    void singleDayRequestOnIntervalBoundary() {
        MergedCoverage coverage = coverage(sub(Capability.DAILY, jan(1, 5)), sub(Capability.DAILY, jan(20, 25)));

        assertThat(engine.evaluate(coverage, Capability.DAILY, jan(5, 5)).granted()).isTrue();
        assertThat(engine.evaluate(coverage, Capability.DAILY, jan(20, 20)).granted()).isTrue();
        assertThat(engine.evaluate(coverage, Capability.DAILY, jan(19, 19)).reason()).isEqualTo(DenialReason.NO_SUBSCRIPTION);
    }

    @Test
    void coveredBySingleSearchesSortedRanges() {
        List<DateRange> merged = List.of(jan(1, 3), jan(6, 9), jan(12, 20), jan(25, 31));

        assertThat(AuthorizationEngine.coveredBySingle(merged, jan(13, 19))).isTrue();
        assertThat(AuthorizationEngine.coveredBySingle(merged, jan(25, 31))).isTrue();
        assertThat(AuthorizationEngine.coveredBySingle(merged, jan(8, 12))).isFalse();
        assertThat(AuthorizationEngine.coveredBySingle(List.of(), jan(1, 1))).isFalse();
    }
}
