package quest.gekko.searchvolume.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import quest.gekko.searchvolume.service.core.model.VolumePoint;

import java.time.format.DateTimeFormatter;

public record VolumePointDTO(
        String time,
        @JsonProperty("search_volume") long searchVolume
) {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    public static VolumePointDTO from(final VolumePoint point) {
        return new VolumePointDTO(FORMAT.format(point.time()), point.volume());
    }
}
