package quest.gekko.searchvolume.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import quest.gekko.searchvolume.service.core.model.DenialReason;
import quest.gekko.searchvolume.service.core.model.KeywordQueryResult;

import java.util.List;

public record KeywordVolumeDTO(
        @JsonProperty("keyword_id") long keywordId,
        @JsonProperty("keyword_name") String keywordName,
        String status,
        String error,
        List<VolumePointDTO> data
) {
    public static final String SUCCESSFUL = "Successful";

    public static KeywordVolumeDTO from(final KeywordQueryResult result) {
        String status = result.verdict().denialReason()
                .map(DenialReason::label)
                .orElse(SUCCESSFUL);
        return new KeywordVolumeDTO(
                result.keywordId(),
                result.keywordName(),
                status,
                String.valueOf(!result.granted()),
                result.data().stream().map(VolumePointDTO::from).toList()
        );
    }
}
