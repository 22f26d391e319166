package com.temenos.error;

import java.io.UncheckedIOException;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the vault error taxonomy onto HTTP statuses.
 * Messages are safe to return: they carry ids and error kinds, never plaintext.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<ErrorResponse> handleConfig(ConfigException ex) {
        log.error("Key configuration error: {}", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Configuration Error", ex.getMessage());
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RecordNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    @ExceptionHandler(IntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(IntegrityException ex) {
        log.error("Decrypt failed: {}", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Decrypt Failed", ex.getMessage());
    }

    @ExceptionHandler(SerializationException.class)
    public ResponseEntity<ErrorResponse> handleSerialization(SerializationException ex) {
        log.error("Corrupt record data: {}", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Corrupt Data", ex.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
        log.debug("Invalid request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
    }

    @ExceptionHandler(MigrationInProgressException.class)
    public ResponseEntity<ErrorResponse> handleMigrationInProgress(MigrationInProgressException ex) {
        log.warn(ex.getMessage());
        return build(HttpStatus.CONFLICT, "Migration In Progress", ex.getMessage());
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleProviderUnavailable(ProviderUnavailableException ex) {
        log.warn(ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Provider Unavailable", ex.getMessage());
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ErrorResponse> handleIo(UncheckedIOException ex) {
        log.error("Storage I/O failure", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Error", "Storage operation failed");
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), error, message, Instant.now()));
    }
}
