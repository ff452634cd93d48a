package jobpulse.runner.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Everything the ledger writes when an attempt finishes: the history row
 * finalisation plus the job's cached run state. Applied in one transaction.
 *
 * @param runId       history row to finalise
 * @param jobId       owning job
 * @param completedAt completion instant (also becomes last_run)
 * @param status      terminal status
 * @param output      bounded output text, may be null
 * @param error       bounded error text, may be null
 * @param nextRun     recomputed next run, null when the schedule is unparsable
 */
public record RunCompletion(
        String runId,
        String jobId,
        Instant completedAt,
        RunStatus status,
        String output,
        String error,
        Instant nextRun) {

    public RunCompletion {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(completedAt, "completedAt is required");
        Objects.requireNonNull(status, "status is required");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Completion status must be terminal, got " + status);
        }
    }
}
