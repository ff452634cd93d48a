package jobpulse.runner.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One execution attempt of a scheduled job. Opened with status RUNNING
 * before the job starts; finalised exactly once with completed_at set.
 */
public final class JobRunHistory {
    private final String id;
    private final String jobId;
    private final Instant startedAt;
    private final Instant completedAt;
    private final RunStatus status;
    private final String output;
    private final String errorMessage;
    private final String triggeredBy;

    private JobRunHistory(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.startedAt = Objects.requireNonNull(builder.startedAt, "startedAt is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.completedAt = builder.completedAt;
        this.output = builder.output;
        this.errorMessage = builder.errorMessage;
        this.triggeredBy = builder.triggeredBy;
    }

    public String id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public RunStatus status() {
        return status;
    }

    public String output() {
        return output;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String triggeredBy() {
        return triggeredBy;
    }

    public boolean isFinished() {
        return completedAt != null;
    }

    /** Wall-clock duration, or null while still running */
    public Duration duration() {
        return completedAt != null ? Duration.between(startedAt, completedAt) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String jobId;
        private Instant startedAt;
        private Instant completedAt;
        private RunStatus status = RunStatus.RUNNING;
        private String output;
        private String errorMessage;
        private String triggeredBy;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder triggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public JobRunHistory build() {
            return new JobRunHistory(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobRunHistory run))
            return false;
        return Objects.equals(id, run.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobRunHistory{id='" + id + "', jobId='" + jobId + "', status=" + status
                + ", startedAt=" + startedAt + ", completedAt=" + completedAt + "}";
    }
}
