package kosukeroku.steam.qualification.checker.web;

import kosukeroku.steam.qualification.checker.exception.CollectionErrorKind;
import kosukeroku.steam.qualification.checker.exception.CollectionException;
import kosukeroku.steam.qualification.checker.exception.SteamApiException;
import kosukeroku.steam.qualification.checker.exception.SteamUserNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Maps check failures to error bodies. A hidden library and a temporary Steam
 * outage get different statuses so callers know whether retrying makes sense.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CollectionException.class)
    public ResponseEntity<Map<String, Object>> handleCollection(CollectionException ex) {
        if (ex.getKind() == CollectionErrorKind.PRIVATE_OR_EMPTY_PROFILE) {
            log.warn("Qualification check refused for {}: profile not accessible", ex.getSteamId());
            return errorResponse(HttpStatus.FORBIDDEN, "private_or_empty_profile", ex.getMessage(), false);
        }
        log.warn("Qualification check failed for {}: {}", ex.getSteamId(), ex.getMessage());
        return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "upstream_unavailable", ex.getMessage(), true);
    }

    @ExceptionHandler(SteamUserNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleUserNotFound(SteamUserNotFoundException ex) {
        return errorResponse(HttpStatus.NOT_FOUND, "user_not_found", ex.getMessage(), false);
    }

    @ExceptionHandler(SteamApiException.class)
    public ResponseEntity<Map<String, Object>> handleSteamApi(SteamApiException ex) {
        log.warn("Steam API failure: {}", ex.getMessage());
        return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "upstream_unavailable", ex.getMessage(), true);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error, String message, boolean retryable) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", error,
                        "message", message,
                        "retryable", retryable,
                        "timestamp", Instant.now().toString()
                ));
    }
}
