package com.regvalidator.validation;

import com.regvalidator.catalog.CatalogRegistry;
import com.regvalidator.domain.CourseCatalog;
import com.regvalidator.domain.Transcript;
import com.regvalidator.validation.engine.CascadeEngine;
import com.regvalidator.validation.engine.CreditLimits;
import com.regvalidator.validation.result.CreditWarning;
import com.regvalidator.validation.result.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for validating one transcript: resolves the catalog, runs the engine with the configured
 * credit limits and logs the outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranscriptValidationService {

    private final CascadeEngine cascadeEngine;
    private final CatalogRegistry catalogRegistry;
    private final CreditLimits creditLimits;

    /**
     * @param catalogId catalog to validate against; the configured default when null or blank
     * @throws com.regvalidator.catalog.CatalogLoadException when the catalog cannot be loaded
     */
    public ValidationResult validate(Transcript transcript, String catalogId) {
        String id = catalogId == null || catalogId.isBlank() ? catalogRegistry.defaultCatalogId() : catalogId;
        CourseCatalog catalog = catalogRegistry.load(id);
        return validate(transcript, catalog);
    }

    public ValidationResult validate(Transcript transcript, CourseCatalog catalog) {
        ValidationResult result = cascadeEngine.validate(transcript, catalog, creditLimits);
        String studentId = transcript.student().hasId() ? transcript.student().id() : "<unknown>";
        for (CreditWarning warning : result.creditWarnings()) {
            log.warn("Student {} {}: {}", studentId, warning.semesterLabel(), warning.message());
        }
        log.info("Validated student {}: {} registrations, {} invalid, {} not in catalog",
                studentId, result.registrationsChecked(), result.invalidCount(), result.notFoundCount());
        return result;
    }
}
