package quest.gekko.searchvolume.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejected request parameters, keyed by parameter name.
 */
public class QueryValidationException extends RuntimeException {
    private final Map<String, String> fieldErrors;

    public QueryValidationException(final Map<String, String> fieldErrors) {
        super("Invalid request parameters: " + String.join(", ", fieldErrors.keySet()));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
