package jobpulse.runner.model;

import java.util.Locale;

/**
 * Status of a single execution attempt, as recorded in the run ledger.
 */
public enum RunStatus {
    /** History row opened, execution in progress (or the runner died) */
    RUNNING,
    /** Process or agent finished with a clean exit */
    SUCCESS,
    /** Advisory job (reviewer/monitor) exited 1 to report findings */
    ISSUES_FOUND,
    /** Non-zero exit, or the agent reported failure */
    FAILED,
    /** Killed after exceeding timeout_seconds */
    TIMEOUT,
    /** Could not spawn or talk to the process/agent */
    ERROR;

    /** SUCCESS and ISSUES_FOUND increment success_count; everything else does not. */
    public boolean countsAsSuccess() {
        return this == SUCCESS || this == ISSUES_FOUND;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * Lenient parse of a stored status value. Unknown or null values map to null.
     */
    public static RunStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
