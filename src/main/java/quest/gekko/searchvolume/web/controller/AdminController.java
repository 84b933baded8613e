package quest.gekko.searchvolume.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import quest.gekko.searchvolume.exception.QueryValidationException;
import quest.gekko.searchvolume.service.core.DailySnapshotService;
import quest.gekko.searchvolume.service.core.model.SnapshotRun;

import java.time.LocalDate;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private final DailySnapshotService snapshotService;

    // Manual derivation trigger, e.g. to backfill after late sample imports
    @PostMapping("/snapshots")
    public SnapshotRun deriveSnapshots(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        if (from.isAfter(to)) {
            throw new QueryValidationException(Map.of("to", "must not be before from"));
        }
        log.info("Manual snapshot derivation requested for {}..{}", from, to);
        return snapshotService.deriveRange(from, to);
    }
}
