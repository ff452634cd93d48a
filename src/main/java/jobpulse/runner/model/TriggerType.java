package jobpulse.runner.model;

/**
 * Trigger type values. Jobs are authored with free-text trigger types
 * ("scheduled", "schedule", "session_start", "manual", ...); only the
 * "scheduled" and "schedule" variants, compared case-insensitively, are
 * considered by due-selection.
 */
public final class TriggerType {

    public static final String SCHEDULED = "scheduled";

    private TriggerType() {
    }
}
