package com.regvalidator.api.controller;

import com.regvalidator.api.dto.ErrorBody;
import com.regvalidator.api.validation.CatalogIdValidator;
import com.regvalidator.domain.Transcript;
import com.regvalidator.report.TextReportRenderer;
import com.regvalidator.transcript.TranscriptDocument;
import com.regvalidator.transcript.TranscriptMapper;
import com.regvalidator.validation.TranscriptValidationService;
import com.regvalidator.validation.result.ValidationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /validations (structured result) and POST /validations/report (plain-text report).
 * Body is transcript JSON; {@code catalog} defaults to the configured catalog.
 */
@RestController
@RequestMapping("/api/v1/validations")
@RequiredArgsConstructor
public class ValidationController {

    private final CatalogIdValidator catalogIdValidator;
    private final TranscriptMapper transcriptMapper;
    private final TranscriptValidationService validationService;
    private final TextReportRenderer reportRenderer;

    @PostMapping
    public ResponseEntity<?> validate(@RequestParam(required = false) String catalog,
                                      @Valid @RequestBody TranscriptDocument document) {
        if (catalog != null && !catalogIdValidator.isValidCatalogId(catalog)) {
            return invalidCatalogId();
        }
        Transcript transcript = transcriptMapper.toDomain(document);
        ValidationResult result = validationService.validate(transcript, catalog);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/report")
    public ResponseEntity<?> report(@RequestParam(required = false) String catalog,
                                    @Valid @RequestBody TranscriptDocument document) {
        if (catalog != null && !catalogIdValidator.isValidCatalogId(catalog)) {
            return invalidCatalogId();
        }
        Transcript transcript = transcriptMapper.toDomain(document);
        ValidationResult result = validationService.validate(transcript, catalog);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(reportRenderer.render(result));
    }

    private static ResponseEntity<ErrorBody> invalidCatalogId() {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_CATALOG_ID", "Invalid catalog id"));
    }
}
