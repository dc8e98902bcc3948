package com.regvalidator.api.controller;

import com.regvalidator.api.dto.ErrorBody;
import com.regvalidator.catalog.CatalogLoadException;
import com.regvalidator.transcript.TranscriptFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps request and input failures to ErrorBody (error, message, timestamp):
 * bind/validation and transcript problems to 400, unknown catalog to 404, broken catalog to 422.
 */
@RestControllerAdvice
@Slf4j
public class ValidationExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadableInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest()
                .body(ErrorBody.of(TranscriptFormatException.TRANSCRIPT_UNREADABLE, "Request body could not be read"));
    }

    @ExceptionHandler(TranscriptFormatException.class)
    public ResponseEntity<ErrorBody> handleTranscript(TranscriptFormatException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(CatalogLoadException.class)
    public ResponseEntity<ErrorBody> handleCatalog(CatalogLoadException ex) {
        if (CatalogLoadException.CATALOG_NOT_FOUND.equals(ex.getErrorCode())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
        }
        log.error("Catalog failed to load [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.unprocessableEntity().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_CATALOG_ID" -> "Invalid catalog id";
            case "TRANSCRIPT_INVALID" -> "Transcript has no 'semesters' array";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
