package jobpulse.runner.repository;

import jobpulse.runner.model.JobRunHistory;
import jobpulse.runner.model.RunCompletion;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the run ledger.
 */
public interface JobRunHistoryRepository {

    /**
     * Insert the opening row of an attempt (status RUNNING, no completed_at).
     *
     * @param run the run to insert
     */
    void start(JobRunHistory run);

    /**
     * Finalise a run and update the owning job in one transaction:
     * history row completed, job's last_* fields and next_run rewritten,
     * run_count incremented, success_count incremented when the status
     * counts as success, claim released.
     *
     * @param completion the completion to apply
     * @return false if the run does not exist or was already finalised
     */
    boolean complete(RunCompletion completion);

    Optional<JobRunHistory> findById(String runId);

    /**
     * Runs of a job, newest first.
     *
     * @param jobId the job ID
     * @return list of runs
     */
    List<JobRunHistory> findByJobId(String jobId);

    /**
     * Rows still RUNNING that started before the cutoff, oldest first.
     *
     * @param startedBefore cutoff
     * @return list of runs
     */
    List<JobRunHistory> findStaleRunning(Instant startedBefore);

    /**
     * Generate a new unique run ID.
     *
     * @return unique ID like "run-{uuid}"
     */
    String generateId();
}
