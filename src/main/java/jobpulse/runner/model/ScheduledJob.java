package jobpulse.runner.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable snapshot of a recurring job as stored in scheduled_jobs.
 * Jobs are authored elsewhere; the runner only rewrites the cached run
 * state (last_*, next_run, counters, claim) after each execution.
 */
public final class ScheduledJob {
    private final String id;
    private final String name;
    private final String description;

    // Execution descriptor
    private final ExecutionType executionType;
    private final String command;
    private final String workingDirectory;
    private final String agentType;
    private final String agentConfig; // JSON, may carry {"task": "..."}

    // Scheduling descriptor
    private final String schedule;
    private final String triggerType;
    private final Integer timeoutSeconds;

    // Control flags
    private final boolean active;
    private final int priority;

    // Cached run state
    private final Instant lastRun;
    private final Instant nextRun;
    private final RunStatus lastStatus;
    private final String lastOutput;
    private final String lastError;
    private final int runCount;
    private final int successCount;

    // Claim
    private final Instant claimedUntil;
    private final String claimedBy;

    private final Instant createdAt;
    private final Instant updatedAt;

    private ScheduledJob(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.description = builder.description;
        this.executionType = builder.executionType != null ? builder.executionType : ExecutionType.SUBPROCESS;
        this.command = builder.command;
        this.workingDirectory = builder.workingDirectory;
        this.agentType = builder.agentType;
        this.agentConfig = builder.agentConfig;
        this.schedule = builder.schedule;
        this.triggerType = builder.triggerType;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.active = builder.active;
        this.priority = builder.priority;
        this.lastRun = builder.lastRun;
        this.nextRun = builder.nextRun;
        this.lastStatus = builder.lastStatus;
        this.lastOutput = builder.lastOutput;
        this.lastError = builder.lastError;
        this.runCount = builder.runCount;
        this.successCount = builder.successCount;
        this.claimedUntil = builder.claimedUntil;
        this.claimedBy = builder.claimedBy;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public ExecutionType executionType() {
        return executionType;
    }

    public String command() {
        return command;
    }

    public String workingDirectory() {
        return workingDirectory;
    }

    public String agentType() {
        return agentType;
    }

    public String agentConfig() {
        return agentConfig;
    }

    public String schedule() {
        return schedule;
    }

    public String triggerType() {
        return triggerType;
    }

    public Integer timeoutSeconds() {
        return timeoutSeconds;
    }

    public boolean isActive() {
        return active;
    }

    public int priority() {
        return priority;
    }

    public Instant lastRun() {
        return lastRun;
    }

    public Instant nextRun() {
        return nextRun;
    }

    public RunStatus lastStatus() {
        return lastStatus;
    }

    public String lastOutput() {
        return lastOutput;
    }

    public String lastError() {
        return lastError;
    }

    public int runCount() {
        return runCount;
    }

    public int successCount() {
        return successCount;
    }

    public Instant claimedUntil() {
        return claimedUntil;
    }

    public String claimedBy() {
        return claimedBy;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** True when the agent strategy applies: agent execution type with an agent identifier. */
    public boolean runsAsAgent() {
        return executionType == ExecutionType.AGENT && !isBlank(agentType);
    }

    /** True when either strategy can be resolved for this job. */
    public boolean hasExecutionDescriptor() {
        return runsAsAgent() || !isBlank(command);
    }

    /**
     * Reviewer and monitor jobs exit 1 to report findings rather than breakage.
     */
    public boolean isAdvisory() {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.contains("review") || lower.contains("monitor");
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .executionType(executionType)
                .command(command)
                .workingDirectory(workingDirectory)
                .agentType(agentType)
                .agentConfig(agentConfig)
                .schedule(schedule)
                .triggerType(triggerType)
                .timeoutSeconds(timeoutSeconds)
                .active(active)
                .priority(priority)
                .lastRun(lastRun)
                .nextRun(nextRun)
                .lastStatus(lastStatus)
                .lastOutput(lastOutput)
                .lastError(lastError)
                .runCount(runCount)
                .successCount(successCount)
                .claimedUntil(claimedUntil)
                .claimedBy(claimedBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private ExecutionType executionType = ExecutionType.SUBPROCESS;
        private String command;
        private String workingDirectory;
        private String agentType;
        private String agentConfig;
        private String schedule;
        private String triggerType = TriggerType.SCHEDULED;
        private Integer timeoutSeconds;
        private boolean active = true;
        private int priority = 5;
        private Instant lastRun;
        private Instant nextRun;
        private RunStatus lastStatus;
        private String lastOutput;
        private String lastError;
        private int runCount;
        private int successCount;
        private Instant claimedUntil;
        private String claimedBy;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder executionType(ExecutionType executionType) {
            this.executionType = executionType;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder agentType(String agentType) {
            this.agentType = agentType;
            return this;
        }

        public Builder agentConfig(String agentConfig) {
            this.agentConfig = agentConfig;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder triggerType(String triggerType) {
            this.triggerType = triggerType;
            return this;
        }

        public Builder timeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder lastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Builder nextRun(Instant nextRun) {
            this.nextRun = nextRun;
            return this;
        }

        public Builder lastStatus(RunStatus lastStatus) {
            this.lastStatus = lastStatus;
            return this;
        }

        public Builder lastOutput(String lastOutput) {
            this.lastOutput = lastOutput;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder runCount(int runCount) {
            this.runCount = runCount;
            return this;
        }

        public Builder successCount(int successCount) {
            this.successCount = successCount;
            return this;
        }

        public Builder claimedUntil(Instant claimedUntil) {
            this.claimedUntil = claimedUntil;
            return this;
        }

        public Builder claimedBy(String claimedBy) {
            this.claimedBy = claimedBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ScheduledJob build() {
            return new ScheduledJob(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScheduledJob job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ScheduledJob{id='" + id + "', name='" + name + "', schedule='" + schedule
                + "', priority=" + priority + ", nextRun=" + nextRun + "}";
    }
}
