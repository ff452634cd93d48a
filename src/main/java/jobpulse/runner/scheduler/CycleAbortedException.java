package jobpulse.runner.scheduler;

/**
 * The cycle could not get past selection, typically because the store is unavailable.
 * Distinct from per-job failures, which never abort a cycle.
 */
public class CycleAbortedException extends RuntimeException {

    public CycleAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
