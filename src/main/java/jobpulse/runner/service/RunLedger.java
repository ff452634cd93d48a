package jobpulse.runner.service;

import jobpulse.runner.config.RunnerConfig;
import jobpulse.runner.execution.ExecutionResult;
import jobpulse.runner.model.JobRunHistory;
import jobpulse.runner.model.RunCompletion;
import jobpulse.runner.model.RunStatus;
import jobpulse.runner.model.ScheduledJob;
import jobpulse.runner.repository.JobRunHistoryRepository;
import jobpulse.runner.schedule.NextRunCalculator;
import jobpulse.runner.util.TextBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Two-phase record of an execution attempt.
 *
 * {@link #open} writes the RUNNING row before the job starts; {@link #close}
 * finalises it and rewrites the job's cached state in one transaction.
 * A row left RUNNING without completed_at means the runner died mid-job.
 *
 * Output is capped at {@code maxOutputChars} and error text at
 * {@code maxErrorChars} before anything is persisted.
 */
public class RunLedger {

    private static final Logger log = LoggerFactory.getLogger(RunLedger.class);

    private final JobRunHistoryRepository runRepository;
    private final NextRunCalculator nextRunCalculator;
    private final Clock clock;
    private final int maxOutputChars;
    private final int maxErrorChars;

    public RunLedger(JobRunHistoryRepository runRepository, NextRunCalculator nextRunCalculator,
            RunnerConfig config, Clock clock) {
        this.runRepository = runRepository;
        this.nextRunCalculator = nextRunCalculator;
        this.clock = clock;
        this.maxOutputChars = config.maxOutputChars();
        this.maxErrorChars = config.maxErrorChars();
    }

    /**
     * Insert the opening RUNNING row.
     */
    public JobRunHistory open(ScheduledJob job, String triggeredBy) {
        JobRunHistory run = JobRunHistory.builder()
                .id(runRepository.generateId())
                .jobId(job.id())
                .startedAt(now())
                .status(RunStatus.RUNNING)
                .triggeredBy(triggeredBy)
                .build();
        runRepository.start(run);
        return run;
    }

    /**
     * Finalise the run and update the job: last_run = completed_at, last_* fields,
     * next_run from the schedule using completed_at as reference, counters, claim released.
     */
    public RunCompletion close(JobRunHistory run, ScheduledJob job, ExecutionResult result) {
        Instant completedAt = now();
        if (completedAt.isBefore(run.startedAt())) {
            completedAt = run.startedAt();
        }

        Instant nextRun = nextRunCalculator.nextRun(job.schedule(), completedAt).orElse(null);
        if (nextRun == null) {
            log.warn("Job {} has unparsable schedule '{}', next_run cleared", job.name(), job.schedule());
        }

        RunCompletion completion = new RunCompletion(
                run.id(),
                job.id(),
                completedAt,
                result.status(),
                TextBounds.truncate(result.output(), maxOutputChars),
                TextBounds.truncate(result.error(), maxErrorChars),
                nextRun);

        if (!runRepository.complete(completion)) {
            log.warn("Run {} of job {} was already finalised, job state left unchanged", run.id(), job.name());
        }
        return completion;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
