package jobpulse.runner.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one invocation cycle.
 *
 * @param startedAt  when the cycle started
 * @param finishedAt when summarising finished
 * @param results    executed jobs in execution order
 * @param skipped    names of jobs another invocation had already claimed
 */
@JsonPropertyOrder({ "startedAt", "finishedAt", "succeeded", "failed", "results", "skipped" })
public record CycleReport(
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("results") List<JobRunSummary> results,
        @JsonProperty("skipped") List<String> skipped) {

    public CycleReport {
        results = List.copyOf(results);
        skipped = List.copyOf(skipped);
    }

    @JsonProperty("succeeded")
    public long succeeded() {
        return results.stream().filter(JobRunSummary::succeeded).count();
    }

    @JsonProperty("failed")
    public long failed() {
        return results.size() - succeeded();
    }

    @JsonIgnore
    public boolean hasFailures() {
        return failed() > 0;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return results.isEmpty() && skipped.isEmpty();
    }

    /** 0 when every executed job counts as success (or nothing ran), otherwise 1 */
    @JsonIgnore
    public int exitCode() {
        return hasFailures() ? 1 : 0;
    }
}
