package com.regvalidator.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.regvalidator.catalog.CatalogLoadException;
import com.regvalidator.catalog.CatalogLoader;
import com.regvalidator.catalog.CatalogProperties;
import com.regvalidator.catalog.CatalogRegistry;
import com.regvalidator.domain.StudentInfo;
import com.regvalidator.domain.Transcript;
import com.regvalidator.report.TextReportRenderer;
import com.regvalidator.transcript.TranscriptFormatException;
import com.regvalidator.transcript.TranscriptMapper;
import com.regvalidator.transcript.TranscriptReader;
import com.regvalidator.validation.TranscriptValidationService;
import com.regvalidator.validation.engine.CascadeEngine;
import com.regvalidator.validation.engine.ConcurrentRegistrationPolicy;
import com.regvalidator.validation.engine.CreditLimitChecker;
import com.regvalidator.validation.engine.CreditLimits;
import com.regvalidator.validation.engine.GpaCalculator;
import com.regvalidator.validation.engine.PrerequisiteResolver;
import com.regvalidator.validation.engine.ValidationReportAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchValidationServiceTest {

    private static final Path CATALOG = Path.of("src/test/resources/catalogs/course_data.json");
    private static final Path SAMPLE_TRANSCRIPT = Path.of("src/test/resources/transcripts/student_6510500001.json");

    @TempDir
    Path inputDir;

    @TempDir
    Path outputDir;

    BatchProperties properties;
    BatchValidationService service;

    private CatalogLoader catalogLoader;
    private TranscriptReader transcriptReader;
    private TranscriptValidationService validationService;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        catalogLoader = new CatalogLoader(objectMapper);
        transcriptReader = new TranscriptReader(objectMapper, new TranscriptMapper());
        CascadeEngine engine = new CascadeEngine(
                new PrerequisiteResolver(new ConcurrentRegistrationPolicy()),
                new ValidationReportAggregator(new CreditLimitChecker(), new GpaCalculator()));
        validationService = new TranscriptValidationService(
                engine, new CatalogRegistry(catalogLoader, new CatalogProperties()), CreditLimits.defaults());
        properties = new BatchProperties();
        service = new BatchValidationService(
                catalogLoader,
                transcriptReader,
                validationService,
                new TextReportRenderer(Clock.systemUTC()),
                properties,
                Runnable::run);
    }

    @Test
    @DisplayName("one report per transcript, named by student id")
    void writesReportPerTranscript() throws IOException {
        Files.copy(SAMPLE_TRANSCRIPT, inputDir.resolve("a.json"));
        Files.writeString(inputDir.resolve("b.json"), """
                {"student_info": {"id": ""},
                 "semesters": [{"semester_type": "First", "year": "2021",
                   "courses": [{"code": "01206322", "name": "Quality Control", "grade": "A", "credits": 3}]}]}
                """);
        Files.writeString(inputDir.resolve("notes.txt"), "ignored");

        BatchSummary summary = service.run(inputDir, CATALOG, outputDir);

        assertThat(summary.processed()).isEqualTo(2);
        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failed()).isZero();
        assertThat(summary.invalidTotal()).isEqualTo(1);
        assertThat(outputDir.resolve("validation_report_6510500001.txt")).exists();
        assertThat(outputDir.resolve("validation_report_b.txt")).exists();
        assertThat(Files.readString(outputDir.resolve("validation_report_b.txt")))
                .contains("INVALID REGISTRATIONS DETAILS");
    }

    @Test
    @DisplayName("a broken transcript is recorded as a failure and does not stop the batch")
    void brokenTranscript_recordedAsFailure() throws IOException {
        Files.copy(SAMPLE_TRANSCRIPT, inputDir.resolve("good.json"));
        Files.writeString(inputDir.resolve("bad.json"), "{\"semesters\": [{\"semester_type\": \"Winter\", \"year\": \"2020\"}]}");

        BatchSummary summary = service.run(inputDir, CATALOG, outputDir);

        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.file()).endsWith("bad.json");
            assertThat(failure.errorCode()).isEqualTo(TranscriptFormatException.TRANSCRIPT_INVALID);
        });
    }

    @Test
    @DisplayName("catalog failure fails every transcript with the catalog error code")
    void catalogFailure_failsAllTranscripts() throws IOException {
        Files.copy(SAMPLE_TRANSCRIPT, inputDir.resolve("a.json"));
        Files.copy(SAMPLE_TRANSCRIPT, inputDir.resolve("b.json"));

        BatchSummary summary = service.run(inputDir, inputDir.resolve("missing-catalog.json"), outputDir);

        assertThat(summary.processed()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(2);
        assertThat(summary.failures()).extracting(BatchJobFailure::errorCode)
                .containsOnly(CatalogLoadException.CATALOG_NOT_FOUND);
        assertThat(outputDir.resolve("validation_report_6510500001.txt")).doesNotExist();
    }

    @Test
    @DisplayName("sub-directories are scanned only when recursive")
    void recursiveScan() throws IOException {
        Path nested = Files.createDirectories(inputDir.resolve("cohort-2020"));
        Files.copy(SAMPLE_TRANSCRIPT, nested.resolve("a.json"));

        assertThat(service.run(inputDir, CATALOG, outputDir).processed()).isZero();

        properties.setRecursive(true);
        assertThat(service.run(inputDir, CATALOG, outputDir).processed()).isEqualTo(1);
    }

    @Test
    @DisplayName("a job that outlives its timeout is reported as JOB_TIMEOUT and writes no report")
    void timedOutJob_writesNoReport() throws Exception {
        Files.copy(SAMPLE_TRANSCRIPT, inputDir.resolve("slow.json"));
        CountDownLatch release = new CountDownLatch(1);
        TextReportRenderer slowRenderer = mock(TextReportRenderer.class);
        when(slowRenderer.render(any())).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return "report";
        });
        List<Thread> workers = new CopyOnWriteArrayList<>();
        Executor threadPerJob = task -> {
            Thread worker = new Thread(task, "batch-test");
            workers.add(worker);
            worker.start();
        };
        properties.setJobTimeoutSeconds(1);
        BatchValidationService slowService = new BatchValidationService(
                catalogLoader, transcriptReader, validationService, slowRenderer, properties, threadPerJob);

        BatchSummary summary = slowService.run(inputDir, CATALOG, outputDir);
        release.countDown();
        for (Thread worker : workers) {
            worker.join(10_000);
        }

        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.failures()).singleElement()
                .satisfies(failure -> assertThat(failure.errorCode()).isEqualTo(BatchValidationService.JOB_TIMEOUT));
        assertThat(outputDir.resolve("validation_report_6510500001.txt")).doesNotExist();
    }

    @Test
    @DisplayName("report file name is sanitised")
    void reportFileNameSanitised() {
        Transcript transcript = new Transcript(new StudentInfo("65/105 001", "", "", ""), List.of());

        assertThat(BatchValidationService.reportFileName(transcript, Path.of("x.json")))
                .isEqualTo("validation_report_65_105_001.txt");
    }
}
