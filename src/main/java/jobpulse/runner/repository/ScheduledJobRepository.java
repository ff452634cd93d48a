package jobpulse.runner.repository;

import jobpulse.runner.model.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for scheduled job persistence.
 */
public interface ScheduledJobRepository {

    /**
     * Save a new job. Used by job submitters and tests; the runner itself never creates jobs.
     *
     * @param job the job to save
     */
    void save(ScheduledJob job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<ScheduledJob> findById(String jobId);

    /**
     * Find a job by its unique name, ignoring case.
     *
     * @param name the job name
     * @return the job if found
     */
    Optional<ScheduledJob> findByName(String name);

    /**
     * Jobs with an execution descriptor whose name contains the fragment, ignoring case.
     *
     * @param fragment part of a job name
     * @return matching jobs ordered by name
     */
    List<ScheduledJob> findByNameLike(String fragment);

    /**
     * All jobs with a command or agent descriptor, ordered by trigger type then name.
     *
     * @return list of jobs
     */
    List<ScheduledJob> findWithExecutionDescriptor();

    /**
     * Active, schedule-triggered, unclaimed jobs with a descriptor that are due at {@code now}:
     * next_run at or before now, or never scheduled and never run, or never
     * scheduled and last run before {@code staleBefore}.
     * Ordered by priority ascending, then next_run ascending with nulls first.
     *
     * @param now         the evaluation instant
     * @param staleBefore fallback cutoff for jobs with a null next_run
     * @param limit       maximum results
     * @return due jobs in execution order
     */
    List<ScheduledJob> findDue(Instant now, Instant staleBefore, int limit);

    /**
     * Atomically reserve a job for one invocation. Succeeds only if the job is
     * unclaimed (or its previous claim expired at or before {@code now}) AND
     * has not completed a run since it was read: its run_count must still be
     * {@code job.runCount()}. A job another invocation has already run and
     * finalised is therefore never claimed again from a stale selection.
     *
     * @param job      the job as read at selection time
     * @param claimant invocation identifier
     * @param now      the current instant
     * @param until    claim expiry
     * @return true if this caller won the claim
     */
    boolean tryClaim(ScheduledJob job, String claimant, Instant now, Instant until);

    /**
     * Drop a claim held by {@code claimant}. A claim since taken over by
     * another invocation is left alone.
     *
     * @return true if a claim was released
     */
    boolean releaseClaim(String jobId, String claimant);
}
