package com.regvalidator.batch;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Batch driver config. When enabled, the application validates every transcript in {@code inputDirectory}
 * against {@code catalogFile} at startup and writes one report per transcript to {@code outputDirectory}.
 */
@ConfigurationProperties(prefix = "regvalidator.batch")
@NoArgsConstructor
@Getter
@Setter
public class BatchProperties {

    private boolean enabled = false;

    private String inputDirectory;

    private String catalogFile;

    private String outputDirectory = "reports";

    /** Size of batch-executor; one transcript per worker at a time. */
    private int workerThreads = 4;

    /** Upper bound on waiting for a single transcript job. */
    private long jobTimeoutSeconds = 30;

    /** Also pick up transcripts in sub-directories. */
    private boolean recursive = false;
}
