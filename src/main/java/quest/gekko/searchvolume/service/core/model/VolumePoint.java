package quest.gekko.searchvolume.service.core.model;

import java.time.LocalDateTime;

public record VolumePoint(LocalDateTime time, long volume) {
}
