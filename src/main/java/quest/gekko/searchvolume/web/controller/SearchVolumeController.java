package quest.gekko.searchvolume.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.searchvolume.service.core.SearchVolumeQueryService;
import quest.gekko.searchvolume.service.core.model.KeywordQueryResult;
import quest.gekko.searchvolume.service.core.model.SearchVolumeQuery;
import quest.gekko.searchvolume.web.dto.KeywordVolumeDTO;
import quest.gekko.searchvolume.web.dto.SearchVolumeResponse;
import quest.gekko.searchvolume.web.request.SearchVolumeRequestParser;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
public class SearchVolumeController {

    private final SearchVolumeRequestParser requestParser;
    private final SearchVolumeQueryService queryService;

    // parameters are optional here so that missing ones are reported together
    @GetMapping("/query")
    public ResponseEntity<SearchVolumeResponse> query(
            @RequestParam(name = SearchVolumeRequestParser.USER_ID, required = false) String userId,
            @RequestParam(name = SearchVolumeRequestParser.KEYWORDS_ID, required = false) String keywordsId,
            @RequestParam(name = SearchVolumeRequestParser.TIMING, required = false) String timing,
            @RequestParam(name = SearchVolumeRequestParser.START_TIME, required = false) String startTime,
            @RequestParam(name = SearchVolumeRequestParser.END_TIME, required = false) String endTime
    ) {
        SearchVolumeQuery query = requestParser.parse(userId, keywordsId, timing, startTime, endTime);
        log.info("Query user={} keywords={} timing={} range={}", query.userId(), query.keywordIds(), query.timing(), query.range());

        List<KeywordQueryResult> results = queryService.execute(query);
        return ResponseEntity.ok(SearchVolumeResponse.ok(results.stream().map(KeywordVolumeDTO::from).toList()));
    }
}
