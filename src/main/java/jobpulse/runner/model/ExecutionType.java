package jobpulse.runner.model;

import java.util.Locale;

/**
 * Discriminator stored in scheduled_jobs.execution_type.
 */
public enum ExecutionType {
    /** Run the command line through the platform shell */
    SUBPROCESS,
    /** Hand a task description to an autonomous agent */
    AGENT;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Null, blank and unknown values default to SUBPROCESS. */
    public static ExecutionType fromDb(String value) {
        if (value != null && "agent".equalsIgnoreCase(value.trim())) {
            return AGENT;
        }
        return SUBPROCESS;
    }
}
