package quest.gekko.searchvolume.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.searchvolume.config.SearchVolumeProperties;
import quest.gekko.searchvolume.service.core.DailySnapshotService;
import quest.gekko.searchvolume.service.core.model.SnapshotRun;

import java.time.LocalDate;

@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotScheduler {
    private final DailySnapshotService snapshotService;
    private final SearchVolumeProperties.Snapshot settings;

    // samples for today keep arriving, so recent days are re-derived on every run
    @Scheduled(cron = "${search-volume.snapshot.cron:0 15 * * * *}", zone = "${search-volume.snapshot.zone:UTC}")
    public void refreshRecentSnapshots() {
        LocalDate today = LocalDate.now(settings.zoneId());
        SnapshotRun run = snapshotService.deriveRange(today.minusDays(settings.lookbackDays()), today);
        if (!run.failedKeywords().isEmpty()) {
            log.warn("Snapshot refresh {}..{} left keywords {} stale", run.from(), run.to(), run.failedKeywords());
        }
    }
}
