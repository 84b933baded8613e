package quest.gekko.searchvolume.web.request;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.searchvolume.config.SearchVolumeProperties;
import quest.gekko.searchvolume.domain.Capability;
import quest.gekko.searchvolume.exception.QueryValidationException;
import quest.gekko.searchvolume.service.core.model.DateRange;
import quest.gekko.searchvolume.service.core.model.SearchVolumeQuery;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw query parameters into a {@link SearchVolumeQuery}. All problems are collected
 * before failing so the caller learns about every offending field at once.
 */
@Component
@RequiredArgsConstructor
public class SearchVolumeRequestParser {
    public static final String USER_ID = "user_id";
    public static final String KEYWORDS_ID = "keywords_id";
    public static final String TIMING = "timing";
    public static final String START_TIME = "start_time";
    public static final String END_TIME = "end_time";

    private final SearchVolumeProperties.Query settings;

    public SearchVolumeQuery parse(final String userId, final String keywordsId, final String timing,
                                   final String startTime, final String endTime) {
        Map<String, String> errors = new LinkedHashMap<>();
        requirePresent(errors, USER_ID, userId);
        requirePresent(errors, KEYWORDS_ID, keywordsId);
        requirePresent(errors, TIMING, timing);
        requirePresent(errors, START_TIME, startTime);
        requirePresent(errors, END_TIME, endTime);

        Long user = errors.containsKey(USER_ID) ? null : parsePositive(errors, USER_ID, userId);
        List<Long> keywords = errors.containsKey(KEYWORDS_ID) ? null : parseKeywords(errors, keywordsId);
        if (!errors.containsKey(TIMING) && !Capability.isSupported(timing)) {
            errors.put(TIMING, "Only support 'HOURLY' and 'DAILY' timing.");
        }
        LocalDate start = errors.containsKey(START_TIME) ? null : parseDate(errors, START_TIME, startTime);
        LocalDate end = errors.containsKey(END_TIME) ? null : parseDate(errors, END_TIME, endTime);
        if (start != null && end != null && start.isAfter(end)) {
            errors.put(END_TIME, "must not be before start_time");
        }

        if (!errors.isEmpty()) {
            throw new QueryValidationException(errors);
        }
        return new SearchVolumeQuery(user, keywords, Capability.valueOf(timing), new DateRange(start, end));
    }

    private static void requirePresent(final Map<String, String> errors, final String field, final String value) {
        if (value == null || value.isBlank()) {
            errors.put(field, "Missing required field");
        }
    }

    private static Long parsePositive(final Map<String, String> errors, final String field, final String value) {
        Long parsed = toLong(value);
        if (parsed != null && parsed > 0) return parsed;
        errors.put(field, "must be a positive integer");
        return null;
    }

    private static Long toLong(final String value) {
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<Long> parseKeywords(final Map<String, String> errors, final String value) {
        Set<Long> ids = new LinkedHashSet<>();
        for (String token : value.split(",")) {
            Long id = parsePositive(errors, KEYWORDS_ID, token);
            if (id == null) {
                errors.put(KEYWORDS_ID, "must be a comma-separated list of positive integers");
                return null;
            }
            ids.add(id);
        }
        return new ArrayList<>(ids);
    }

    private LocalDate parseDate(final Map<String, String> errors, final String field, final String value) {
        try {
            return Instant.ofEpochSecond(Long.parseLong(value.trim())).atZone(settings.zoneId()).toLocalDate();
        } catch (NumberFormatException | DateTimeException e) {
            errors.put(field, "must be a unix timestamp in seconds");
            return null;
        }
    }
}
