package jobpulse.runner.scheduler;

import jobpulse.runner.config.RunnerConfig;
import jobpulse.runner.execution.ExecutionResult;
import jobpulse.runner.execution.JobExecutor;
import jobpulse.runner.model.JobRunHistory;
import jobpulse.runner.model.RunCompletion;
import jobpulse.runner.model.RunStatus;
import jobpulse.runner.model.ScheduledJob;
import jobpulse.runner.repository.ScheduledJobRepository;
import jobpulse.runner.service.DueJobSelector;
import jobpulse.runner.service.RunLedger;
import jobpulse.runner.service.StaleRunMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one invocation cycle: select due jobs, then for each job in order
 * claim it, open the run, execute, close the run; finally summarise.
 *
 * Strictly sequential. A job's failure, including a failed ledger write,
 * is recorded for that job and the loop moves on; only a failure while
 * selecting aborts the cycle.
 */
public class SchedulerDriver {

    private static final Logger log = LoggerFactory.getLogger(SchedulerDriver.class);

    /** triggered_by label for forced runs */
    public static final String FORCE_TRIGGER = "force";

    private final DueJobSelector selector;
    private final JobExecutor executor;
    private final RunLedger ledger;
    private final StaleRunMonitor staleRunMonitor;
    private final ScheduledJobRepository jobRepository;
    private final Clock clock;
    private final String triggeredBy;
    private final Duration claimGrace;
    private final String claimant;

    private volatile CyclePhase phase = CyclePhase.IDLE;

    public SchedulerDriver(DueJobSelector selector, JobExecutor executor, RunLedger ledger,
            StaleRunMonitor staleRunMonitor, ScheduledJobRepository jobRepository,
            RunnerConfig config, Clock clock) {
        this.selector = selector;
        this.executor = executor;
        this.ledger = ledger;
        this.staleRunMonitor = staleRunMonitor;
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.triggeredBy = config.triggeredBy();
        this.claimGrace = config.claimGrace();
        this.claimant = "runner-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Run every currently due job (up to the batch cap).
     *
     * @throws CycleAbortedException if due jobs cannot be selected
     */
    public CycleReport runCycle() {
        Instant startedAt = clock.instant();
        List<ScheduledJob> due = select();
        return execute(due, triggeredBy, startedAt);
    }

    /**
     * Selection only, nothing executed or persisted.
     *
     * @throws CycleAbortedException if due jobs cannot be selected
     */
    public List<ScheduledJob> preview() {
        try {
            return selector.selectDue();
        } catch (RuntimeException e) {
            throw new CycleAbortedException("Cannot select due jobs: " + e.getMessage(), e);
        }
    }

    /**
     * Run jobs by name regardless of their schedule, through the same
     * executor and ledger path. An exact (case-insensitive) name wins;
     * otherwise every job whose name contains the text.
     *
     * @return empty when no job matches
     * @throws CycleAbortedException if the store cannot be queried
     */
    public Optional<CycleReport> runForced(String name) {
        Instant startedAt = clock.instant();
        List<ScheduledJob> jobs = resolveForced(name);
        if (jobs.isEmpty()) {
            log.warn("No job found matching '{}'", name);
            return Optional.empty();
        }
        return Optional.of(execute(jobs, FORCE_TRIGGER, startedAt));
    }

    /**
     * Jobs a forced run of {@code name} would execute.
     */
    public List<ScheduledJob> resolveForced(String name) {
        phase = CyclePhase.SELECTING;
        try {
            Optional<ScheduledJob> exact = jobRepository.findByName(name);
            if (exact.isPresent() && exact.get().hasExecutionDescriptor()) {
                return List.of(exact.get());
            }
            return jobRepository.findByNameLike(name);
        } catch (RuntimeException e) {
            throw new CycleAbortedException("Cannot look up job '" + name + "': " + e.getMessage(), e);
        } finally {
            phase = CyclePhase.IDLE;
        }
    }

    public CyclePhase phase() {
        return phase;
    }

    public String claimant() {
        return claimant;
    }

    private List<ScheduledJob> select() {
        phase = CyclePhase.SELECTING;
        try {
            reportStaleRuns();
            List<ScheduledJob> due = selector.selectDue();
            log.info("{} job(s) due", due.size());
            return due;
        } catch (RuntimeException e) {
            phase = CyclePhase.IDLE;
            log.error("Selecting due jobs failed, aborting cycle", e);
            throw new CycleAbortedException("Cannot select due jobs: " + e.getMessage(), e);
        }
    }

    private void releaseClaim(ScheduledJob job) {
        try {
            jobRepository.releaseClaim(job.id(), claimant);
        } catch (RuntimeException e) {
            log.warn("Could not release claim on job {}, it expires on its own: {}", job.name(), e.getMessage());
        }
    }

    private void reportStaleRuns() {
        try {
            staleRunMonitor.findStaleRuns();
        } catch (RuntimeException e) {
            log.warn("Stale run check failed: {}", e.getMessage());
        }
    }

    private CycleReport execute(List<ScheduledJob> jobs, String trigger, Instant startedAt) {
        List<JobRunSummary> results = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (ScheduledJob job : jobs) {
            Optional<JobRunSummary> summary = runOne(job, trigger);
            if (summary.isPresent()) {
                results.add(summary.get());
            } else {
                skipped.add(job.name());
            }
        }

        phase = CyclePhase.SUMMARIZING;
        CycleReport report = new CycleReport(startedAt, clock.instant(), results, skipped);
        log.info("Cycle finished: {} succeeded, {} failed, {} skipped",
                report.succeeded(), report.failed(), skipped.size());
        phase = CyclePhase.IDLE;
        return report;
    }

    /**
     * Claim, open, execute, close. Empty when another invocation holds the claim.
     */
    private Optional<JobRunSummary> runOne(ScheduledJob job, String trigger) {
        JobRunHistory run = null;
        boolean claimed = false;
        try {
            Instant now = clock.instant();
            Instant claimUntil = now.plus(executor.timeoutFor(job)).plus(claimGrace);
            if (!jobRepository.tryClaim(job, claimant, now, claimUntil)) {
                log.info("Job {} is claimed by another invocation or already ran, skipping", job.name());
                return Optional.empty();
            }
            claimed = true;

            phase = CyclePhase.EXECUTING;
            run = ledger.open(job, trigger);
            ExecutionResult result = executor.execute(job);

            phase = CyclePhase.FINALIZING;
            RunCompletion completion = ledger.close(run, job, result);

            return Optional.of(new JobRunSummary(job.id(), job.name(), run.id(), completion.status(),
                    result.duration(), completion.nextRun(), completion.error()));
        } catch (RuntimeException e) {
            log.error("Ledger failure for job {}: {}", job.name(), e.getMessage(), e);
            if (claimed) {
                releaseClaim(job);
            }
            return Optional.of(new JobRunSummary(job.id(), job.name(), run != null ? run.id() : null,
                    RunStatus.ERROR, null, null, "Ledger failure: " + e.getMessage()));
        }
    }
}
