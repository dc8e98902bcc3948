package com.regvalidator.batch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs one batch at startup from regvalidator.batch.* when regvalidator.batch.enabled=true.
 */
@Component
@ConditionalOnProperty(prefix = "regvalidator.batch", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BatchValidationRunner implements ApplicationRunner {

    private final BatchValidationService batchValidationService;
    private final BatchProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (isBlank(properties.getInputDirectory()) || isBlank(properties.getCatalogFile())) {
            log.error("Batch enabled but regvalidator.batch.input-directory or catalog-file is not set");
            return;
        }
        BatchSummary summary = batchValidationService.run(
                Path.of(properties.getInputDirectory()),
                Path.of(properties.getCatalogFile()),
                Path.of(properties.getOutputDirectory()));
        for (BatchJobFailure failure : summary.failures()) {
            log.warn("Not validated: {} [{}] {}", failure.file(), failure.errorCode(), failure.message());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
