package quest.gekko.searchvolume.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Envelope of every answer of the query API: {@code search_volume} on success,
 * {@code errors} otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchVolumeResponse {
    private boolean success;
    private String message;

    @JsonProperty("search_volume")
    private List<KeywordVolumeDTO> searchVolume;

    private Object errors;

    public static SearchVolumeResponse ok(final List<KeywordVolumeDTO> results) {
        return SearchVolumeResponse.builder()
                .success(true)
                .message("Query executed successfully")
                .searchVolume(results)
                .build();
    }

    public static SearchVolumeResponse failure(final String message, final Object errors) {
        return SearchVolumeResponse.builder()
                .success(false)
                .message(message)
                .errors(errors)
                .build();
    }
}
