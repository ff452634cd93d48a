package jobpulse.runner.service;

import jobpulse.runner.config.RunnerConfig;
import jobpulse.runner.model.JobRunHistory;
import jobpulse.runner.repository.JobRunHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reports history rows stuck in RUNNING longer than the threshold.
 *
 * Such rows are left behind when a runner process dies mid-job. They are
 * only reported, never rewritten: the row is the evidence.
 */
public class StaleRunMonitor {

    private static final Logger log = LoggerFactory.getLogger(StaleRunMonitor.class);

    private final JobRunHistoryRepository runRepository;
    private final Duration threshold;
    private final Clock clock;

    public StaleRunMonitor(JobRunHistoryRepository runRepository, RunnerConfig config, Clock clock) {
        this.runRepository = runRepository;
        this.threshold = config.staleRunThreshold();
        this.clock = clock;
    }

    /**
     * @return stale runs, oldest first
     */
    public List<JobRunHistory> findStaleRuns() {
        Instant cutoff = clock.instant().minus(threshold);
        List<JobRunHistory> stale = runRepository.findStaleRunning(cutoff);

        for (JobRunHistory run : stale) {
            log.warn("Run {} of job {} still RUNNING since {} (triggered by {}); runner likely died",
                    run.id(), run.jobId(), run.startedAt(), run.triggeredBy());
        }
        if (!stale.isEmpty()) {
            log.warn("{} stale run(s) older than {}", stale.size(), threshold);
        }
        return stale;
    }
}
