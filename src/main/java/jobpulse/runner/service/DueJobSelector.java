package jobpulse.runner.service;

import jobpulse.runner.config.RunnerConfig;
import jobpulse.runner.model.ScheduledJob;
import jobpulse.runner.repository.ScheduledJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Picks the jobs one invocation should run, capped at the batch size.
 * Jobs beyond the cap wait for the next invocation.
 */
public class DueJobSelector {

    private static final Logger log = LoggerFactory.getLogger(DueJobSelector.class);

    private final ScheduledJobRepository jobRepository;
    private final Clock clock;
    private final int batchSize;
    private final Duration stalenessWindow;

    public DueJobSelector(ScheduledJobRepository jobRepository, RunnerConfig config, Clock clock) {
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.batchSize = config.batchSize();
        this.stalenessWindow = config.stalenessWindow();
    }

    /**
     * @return due jobs ordered by priority, then next_run with nulls first
     * @throws jobpulse.runner.store.StoreException if the store cannot be queried
     */
    public List<ScheduledJob> selectDue() {
        Instant now = clock.instant();
        List<ScheduledJob> due = jobRepository.findDue(now, now.minus(stalenessWindow), batchSize);
        log.debug("{} job(s) due at {} (batch size {})", due.size(), now, batchSize);
        return due;
    }

    public int batchSize() {
        return batchSize;
    }
}
