package quest.gekko.searchvolume.service.core;

import org.junit.jupiter.api.Test;
import quest.gekko.searchvolume.service.core.model.DailySnapshot;
import quest.gekko.searchvolume.service.core.model.Sample;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotDeriverTest {
    private static final LocalDate DAY = LocalDate.of(2025, 1, 15);

    private final SnapshotDeriver deriver = new SnapshotDeriver();

    private static Sample at(int hour, int minute, long volume) {
        return new Sample(1L, DAY.atTime(hour, minute), volume);
    }

    @Test
    void picksTheAnchorHourWhenPresent() {
        List<Sample> samples = new ArrayList<>();
        for (int h = 0; h < 24; h++) {
            samples.add(at(h, 0, 100 + h));
        }

        DailySnapshot snapshot = deriver.derive(1L, DAY, samples).orElseThrow();

        assertThat(snapshot.anchorTimestamp()).isEqualTo(DAY.atTime(9, 0));
        assertThat(snapshot.volume()).isEqualTo(109);
        assertThat(snapshot.date()).isEqualTo(DAY);
    }

    @Test
    void equidistantSamplesResolveToTheEarlierOne() {
        Sample eight = at(8, 0, 800);
        Sample ten = at(10, 0, 1000);

        DailySnapshot forward = deriver.derive(1L, DAY, List.of(eight, ten)).orElseThrow();
        DailySnapshot backward = deriver.derive(1L, DAY, List.of(ten, eight)).orElseThrow();

        assertThat(forward.anchorTimestamp()).isEqualTo(DAY.atTime(8, 0));
        assertThat(forward.volume()).isEqualTo(800);
        assertThat(backward).isEqualTo(forward);
    }

    @Test
    void fallsBackToNearestAvailableSample() {
        List<Sample> samples = List.of(at(0, 0, 1), at(6, 0, 6), at(11, 0, 11), at(23, 0, 23));

        DailySnapshot snapshot = deriver.derive(1L, DAY, samples).orElseThrow();

        assertThat(snapshot.anchorTimestamp()).isEqualTo(DAY.atTime(11, 0));
    }

    @Test
    void comparesToTheSecond() {
        DailySnapshot snapshot = deriver.derive(1L, DAY, List.of(at(8, 30, 1), at(9, 29, 2))).orElseThrow();

        assertThat(snapshot.volume()).isEqualTo(2);
    }

    @Test
    void noSamplesMeansNoSnapshot() {
        assertThat(deriver.derive(1L, DAY, List.of())).isEmpty();
    }

    @Test
    void derivationIsIdempotentAndOrderIndependent() {
        List<Sample> samples = new ArrayList<>(List.of(at(3, 0, 3), at(7, 0, 7), at(11, 0, 11), at(15, 0, 15)));

        DailySnapshot first = deriver.derive(1L, DAY, samples).orElseThrow();
        Collections.shuffle(samples);
        DailySnapshot second = deriver.derive(1L, DAY, samples).orElseThrow();

        assertThat(second).isEqualTo(first);
        assertThat(first.anchorTimestamp()).isEqualTo(DAY.atTime(7, 0));
    }

    @Test
    void rejectsSamplesOfOtherDatesOrKeywords() {
        Sample otherDay = new Sample(1L, DAY.plusDays(1).atTime(9, 0), 5);
        Sample otherKeyword = new Sample(2L, DAY.atTime(9, 0), 5);

        assertThatThrownBy(() -> deriver.derive(1L, DAY, List.of(at(9, 0, 1), otherDay)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> deriver.derive(1L, DAY, List.of(otherKeyword)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void anchorTimeIsConfigurable() {
        SnapshotDeriver noon = new SnapshotDeriver(LocalTime.NOON);

        DailySnapshot snapshot = noon.derive(1L, DAY, List.of(at(9, 0, 9), at(13, 0, 13))).orElseThrow();

        assertThat(noon.anchorOf(DAY)).isEqualTo(LocalDateTime.of(2025, 1, 15, 12, 0));
        assertThat(snapshot.volume()).isEqualTo(13);
    }

    @Test
    void deriveDailyProducesOneSnapshotPerDateWithSamples() {
        List<Sample> samples = List.of(
                new Sample(1L, LocalDateTime.of(2025, 1, 2, 9, 0), 20),
                new Sample(1L, LocalDateTime.of(2025, 1, 1, 10, 0), 10),
                new Sample(1L, LocalDateTime.of(2025, 1, 1, 22, 0), 11),
                new Sample(1L, LocalDateTime.of(2025, 1, 4, 0, 0), 40)
        );

        List<DailySnapshot> snapshots = deriver.deriveDaily(1L, samples);

        assertThat(snapshots).extracting(DailySnapshot::date)
                .containsExactly(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 2), LocalDate.of(2025, 1, 4));
        assertThat(snapshots).extracting(DailySnapshot::volume).containsExactly(10L, 20L, 40L);
    }
}
