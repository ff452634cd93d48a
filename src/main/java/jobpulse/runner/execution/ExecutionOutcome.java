package jobpulse.runner.execution;

import jobpulse.runner.model.RunStatus;

import java.time.Duration;

/**
 * Classified result of a job that actually ran (or was killed on timeout).
 *
 * @param status   SUCCESS, ISSUES_FOUND, FAILED or TIMEOUT
 * @param output   captured output, may be null
 * @param error    captured error text, may be null
 * @param exitCode process exit code, null for agent runs and timeouts
 * @param duration wall-clock time
 */
public record ExecutionOutcome(
        RunStatus status,
        String output,
        String error,
        Integer exitCode,
        Duration duration) {
}
