package jobpulse.runner.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jobpulse.runner.model.RunStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-job line of a cycle report.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRunSummary(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("jobName") String jobName,
        @JsonProperty("runId") String runId,
        @JsonProperty("status") RunStatus status,
        @JsonProperty("duration") Duration duration,
        @JsonProperty("nextRun") Instant nextRun,
        @JsonProperty("error") String error) {

    @JsonIgnore
    public boolean succeeded() {
        return status.countsAsSuccess();
    }
}
