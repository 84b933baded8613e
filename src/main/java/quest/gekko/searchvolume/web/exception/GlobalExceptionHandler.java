package quest.gekko.searchvolume.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import quest.gekko.searchvolume.exception.AccessDeniedForAllKeywordsException;
import quest.gekko.searchvolume.exception.QueryValidationException;
import quest.gekko.searchvolume.exception.StorageUnavailableException;
import quest.gekko.searchvolume.web.dto.SearchVolumeResponse;

import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<SearchVolumeResponse> handleValidation(QueryValidationException ex, HttpServletRequest request) {
        log.warn("Validation failed for URL {}: {}", request.getRequestURL(), ex.getFieldErrors());
        return ResponseEntity.badRequest().body(SearchVolumeResponse.failure("Validation failed", ex.getFieldErrors()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<SearchVolumeResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity.badRequest().body(SearchVolumeResponse.failure("Validation failed",
                Map.of(ex.getParameterName(), "Missing required field")));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<SearchVolumeResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity.badRequest().body(SearchVolumeResponse.failure("Validation failed",
                Map.of(ex.getName(), "Invalid value '" + ex.getValue() + "'")));
    }

    @ExceptionHandler(AccessDeniedForAllKeywordsException.class)
    public ResponseEntity<SearchVolumeResponse> handleAllDenied(AccessDeniedForAllKeywordsException ex) {
        log.info("Rejected query of user {}: no access to keywords {}", ex.getUserId(), ex.getKeywordIds());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(SearchVolumeResponse.failure("Unauthorized keywords", ex.getKeywordIds()));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<SearchVolumeResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        log.warn("Access denied for URL {}", request.getRequestURL());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(SearchVolumeResponse.failure("Access denied", ex.getMessage()));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<SearchVolumeResponse> handleStorageUnavailable(StorageUnavailableException ex, HttpServletRequest request) {
        log.error("Storage failure for URL {}", request.getRequestURL(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(SearchVolumeResponse.failure("Storage unavailable", ex.getMessage()));
    }

    /**
     * Client errors raised by Spring MVC itself (unknown path, wrong method, unsupported body)
     * keep their own status code.
     */
    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            ErrorResponseException.class
    })
    public ResponseEntity<SearchVolumeResponse> handleFrameworkError(Exception ex, HttpServletRequest request) {
        final ErrorResponse error = (ErrorResponse) ex;
        final HttpStatusCode status = error.getStatusCode();
        log.warn("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(), status.value(), ex.getMessage());
        return ResponseEntity.status(status)
                .headers(error.getHeaders())
                .body(SearchVolumeResponse.failure(error.getBody().getTitle(), error.getBody().getDetail()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<SearchVolumeResponse> handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(SearchVolumeResponse.failure("Internal Server Error", "An unexpected error occurred"));
    }
}
