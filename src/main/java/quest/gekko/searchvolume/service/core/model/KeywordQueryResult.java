package quest.gekko.searchvolume.service.core.model;

import java.util.List;

/**
 * Per-keyword part of a batch answer. Denied keywords carry no data.
 */
public record KeywordQueryResult(long keywordId, String keywordName, AuthorizationVerdict verdict, List<VolumePoint> data) {

    public KeywordQueryResult {
        data = List.copyOf(data);
    }

    public boolean granted() {
        return verdict.granted();
    }
}
