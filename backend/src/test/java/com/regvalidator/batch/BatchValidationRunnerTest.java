package com.regvalidator.batch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchValidationRunnerTest {

    @Mock
    BatchValidationService batchValidationService;

    BatchProperties properties;
    BatchValidationRunner runner;

    @BeforeEach
    void setUp() {
        properties = new BatchProperties();
        properties.setEnabled(true);
        runner = new BatchValidationRunner(batchValidationService, properties);
    }

    @Test
    @DisplayName("runs the configured batch once")
    void runsConfiguredBatch() {
        properties.setInputDirectory("transcripts");
        properties.setCatalogFile("catalogs/course_data.json");
        properties.setOutputDirectory("out");
        when(batchValidationService.run(any(), any(), any()))
                .thenReturn(new BatchSummary(1, 1, 0, 0, List.of()));

        runner.run(new DefaultApplicationArguments());

        verify(batchValidationService).run(
                Path.of("transcripts"), Path.of("catalogs/course_data.json"), Path.of("out"));
    }

    @Test
    @DisplayName("does nothing when input directory or catalog file is missing")
    void skipsWithoutPaths() {
        properties.setInputDirectory("transcripts");

        runner.run(new DefaultApplicationArguments());

        verify(batchValidationService, never()).run(any(), any(), any());
    }
}
