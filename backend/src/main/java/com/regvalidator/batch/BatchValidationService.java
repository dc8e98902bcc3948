package com.regvalidator.batch;

import com.regvalidator.catalog.CatalogLoadException;
import com.regvalidator.catalog.CatalogLoader;
import com.regvalidator.config.AsyncConfig;
import com.regvalidator.domain.CourseCatalog;
import com.regvalidator.domain.Transcript;
import com.regvalidator.report.TextReportRenderer;
import com.regvalidator.transcript.TranscriptFormatException;
import com.regvalidator.transcript.TranscriptReader;
import com.regvalidator.validation.TranscriptValidationService;
import com.regvalidator.validation.result.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Validates a directory of transcripts against one catalog, one job per transcript on batch-executor.
 * The catalog is loaded once and shared read-only; a failing job is recorded and never stops the batch.
 */
@Service
@Slf4j
public class BatchValidationService {

    public static final String REPORT_WRITE_FAILED = "REPORT_WRITE_FAILED";
    public static final String JOB_TIMEOUT = "JOB_TIMEOUT";
    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";

    private static final String REPORT_PREFIX = "validation_report_";
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final CatalogLoader catalogLoader;
    private final TranscriptReader transcriptReader;
    private final TranscriptValidationService validationService;
    private final TextReportRenderer reportRenderer;
    private final BatchProperties properties;
    private final Executor batchExecutor;

    public BatchValidationService(CatalogLoader catalogLoader,
                                  TranscriptReader transcriptReader,
                                  TranscriptValidationService validationService,
                                  TextReportRenderer reportRenderer,
                                  BatchProperties properties,
                                  @Qualifier(AsyncConfig.BATCH_EXECUTOR) Executor batchExecutor) {
        this.catalogLoader = catalogLoader;
        this.transcriptReader = transcriptReader;
        this.validationService = validationService;
        this.reportRenderer = reportRenderer;
        this.properties = properties;
        this.batchExecutor = batchExecutor;
    }

    public BatchSummary run(Path inputDir, Path catalogFile, Path outputDir) {
        List<Path> transcripts = listTranscripts(inputDir);
        log.info("Batch started: {} transcript(s) in {}, catalog {}", transcripts.size(), inputDir, catalogFile);

        CourseCatalog catalog;
        try {
            catalog = catalogLoader.load(catalogFile);
        } catch (CatalogLoadException e) {
            log.error("Batch aborted, catalog {} failed to load [{}]: {}", catalogFile, e.getErrorCode(), e.getMessage());
            List<BatchJobFailure> failures = transcripts.stream()
                    .map(t -> new BatchJobFailure(t.toString(), e.getErrorCode(), e.getMessage()))
                    .toList();
            return new BatchSummary(transcripts.size(), 0, failures.size(), 0, failures);
        }

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + outputDir, e);
        }

        long timeoutNanos = TimeUnit.SECONDS.toNanos(properties.getJobTimeoutSeconds());
        List<Job> jobs = new ArrayList<>();
        for (Path transcript : transcripts) {
            AtomicBoolean settled = new AtomicBoolean();
            CompletableFuture<JobOutcome> future = CompletableFuture.supplyAsync(
                    () -> runJob(transcript, catalog, outputDir, settled), batchExecutor);
            jobs.add(new Job(transcript, future, settled, System.nanoTime() + timeoutNanos));
        }

        List<BatchJobFailure> failures = new ArrayList<>();
        int succeeded = 0;
        int invalidTotal = 0;
        for (Job job : jobs) {
            JobOutcome outcome = await(job);
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            } else {
                succeeded++;
                invalidTotal += outcome.invalidCount();
            }
        }

        BatchSummary summary = new BatchSummary(transcripts.size(), succeeded, failures.size(), invalidTotal, failures);
        log.info("Batch finished: processed={} succeeded={} failed={} invalidRegistrations={}",
                summary.processed(), summary.succeeded(), summary.failed(), summary.invalidTotal());
        return summary;
    }

    /**
     * Waits until the job's deadline, counted from submission. Whichever side sets {@code settled} first wins:
     * a job that claimed it is writing its report and is awaited to the end; otherwise the job is abandoned and
     * writes nothing.
     */
    private JobOutcome await(Job job) {
        Path transcript = job.file();
        CompletableFuture<JobOutcome> future = job.future();
        try {
            long remaining = Math.max(0L, job.deadlineNanos() - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (!job.settled().compareAndSet(false, true)) {
                return future.join();
            }
            future.cancel(true);
            log.warn("Transcript {} timed out after {}s", transcript, properties.getJobTimeoutSeconds());
            return JobOutcome.failed(transcript, JOB_TIMEOUT,
                    "Timed out after " + properties.getJobTimeoutSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return JobOutcome.failed(transcript, VALIDATION_FAILED, "Interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Transcript {} failed: {}", transcript, cause.getMessage(), cause);
            return JobOutcome.failed(transcript, VALIDATION_FAILED, cause.getMessage());
        }
    }

    private JobOutcome runJob(Path file, CourseCatalog catalog, Path outputDir, AtomicBoolean settled) {
        try {
            Transcript transcript = transcriptReader.read(file);
            ValidationResult result = validationService.validate(transcript, catalog);
            Path report = outputDir.resolve(reportFileName(transcript, file));
            String text = reportRenderer.render(result);
            if (!settled.compareAndSet(false, true)) {
                log.warn("Transcript {} finished after its timeout; report not written", file);
                return JobOutcome.failed(file, JOB_TIMEOUT, "Finished after timeout");
            }
            Files.writeString(report, text);
            log.info("Report written: {}", report);
            return JobOutcome.succeeded(result.invalidCount());
        } catch (TranscriptFormatException e) {
            log.warn("Transcript {} rejected [{}]: {}", file, e.getErrorCode(), e.getMessage());
            return JobOutcome.failed(file, e.getErrorCode(), e.getMessage());
        } catch (IOException e) {
            log.error("Cannot write report for {}: {}", file, e.getMessage());
            return JobOutcome.failed(file, REPORT_WRITE_FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Validation of {} failed", file, e);
            return JobOutcome.failed(file, VALIDATION_FAILED, e.getMessage());
        }
    }

    /** validation_report_&lt;studentId&gt;.txt, or the transcript file stem when the id is blank. */
    static String reportFileName(Transcript transcript, Path source) {
        String key;
        if (transcript.student().hasId()) {
            key = transcript.student().id().trim();
        } else {
            String name = source.getFileName().toString();
            int dot = name.lastIndexOf('.');
            key = dot > 0 ? name.substring(0, dot) : name;
        }
        return REPORT_PREFIX + UNSAFE_FILE_CHARS.matcher(key).replaceAll("_") + ".txt";
    }

    private List<Path> listTranscripts(Path inputDir) {
        if (!Files.isDirectory(inputDir)) {
            throw new IllegalArgumentException("Input directory does not exist: " + inputDir);
        }
        int depth = properties.isRecursive() ? Integer.MAX_VALUE : 1;
        try (Stream<Path> paths = Files.walk(inputDir, depth)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list transcripts in " + inputDir, e);
        }
    }

    private record Job(Path file, CompletableFuture<JobOutcome> future, AtomicBoolean settled,
                       long deadlineNanos) {
    }

    private record JobOutcome(int invalidCount, BatchJobFailure failure) {

        static JobOutcome succeeded(int invalidCount) {
            return new JobOutcome(invalidCount, null);
        }

        static JobOutcome failed(Path file, String errorCode, String message) {
            return new JobOutcome(0, new BatchJobFailure(file.toString(), errorCode, message));
        }
    }
}
