package com.shafts.catalog.controller;

import com.shafts.catalog.exception.CatalogException;
import com.shafts.catalog.exception.DuplicateKeyException;
import com.shafts.catalog.exception.InvalidComparisonSizeException;
import com.shafts.catalog.exception.InvalidFilterException;
import com.shafts.catalog.exception.NormalizationException;
import com.shafts.catalog.exception.ShaftNotFoundException;
import com.shafts.catalog.exception.SnapshotNotConfiguredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps catalog failures to HTTP responses with a JSON body
 * <code>{"error": "...", "code": "...", "field": "..."}</code> ({@code field} only for
 * normalization failures).
 * <ul>
 *   <li>400 BAD REQUEST: invalid filter, comparison size, unknown label or malformed body</li>
 *   <li>404 NOT FOUND: unknown shaft key</li>
 *   <li>409 CONFLICT: duplicate key, snapshot requested without a snapshot file</li>
 *   <li>422 UNPROCESSABLE ENTITY: a replacement record violates the canonical schema</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class CatalogExceptionHandler {

    @ExceptionHandler(NormalizationException.class)
    public ResponseEntity<Map<String, String>> handleNormalization(final NormalizationException ex) {
        log.warn("Rejected record: {}", ex.getMessage());
        Map<String, String> body = body(ex.getMessage(), ex.getCode());
        body.put("field", ex.getField());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(ShaftNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(final ShaftNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<Map<String, String>> handleDuplicate(final DuplicateKeyException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler({InvalidFilterException.class, InvalidComparisonSizeException.class})
    public ResponseEntity<Map<String, String>> handleInvalidRequest(final CatalogException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    /**
     * Unknown enum labels in query parameters, bad numbers, unknown export formats.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(final IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body(ex.getMessage(), "BAD_REQUEST"));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, String>> handleMalformedRequest(final Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("Malformed request: " + ex.getMessage(), "BAD_REQUEST"));
    }

    @ExceptionHandler(SnapshotNotConfiguredException.class)
    public ResponseEntity<Map<String, String>> handleSnapshotNotConfigured(final SnapshotNotConfiguredException ex) {
        log.warn("Unavailable: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleIo(final IOException ex) {
        log.error("I/O failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body(ex.getMessage(), "IO_ERROR"));
    }

    private static ResponseEntity<Map<String, String>> respond(final HttpStatus status, final CatalogException ex) {
        return ResponseEntity.status(status).body(body(ex.getMessage(), ex.getCode()));
    }

    private static Map<String, String> body(final String message, final String code) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message == null ? "" : message);
        body.put("code", code);
        return body;
    }
}
