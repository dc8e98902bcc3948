package com.regvalidator.batch;

import java.util.List;

/**
 * Outcome of a batch run. {@code invalidTotal} sums invalid registrations over successfully validated transcripts.
 */
public record BatchSummary(int processed, int succeeded, int failed, int invalidTotal, List<BatchJobFailure> failures) {

    public BatchSummary {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
