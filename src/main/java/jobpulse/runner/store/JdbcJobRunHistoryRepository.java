package jobpulse.runner.store;

import jobpulse.runner.model.JobRunHistory;
import jobpulse.runner.model.RunCompletion;
import jobpulse.runner.model.RunStatus;
import jobpulse.runner.repository.JobRunHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static jobpulse.runner.store.JdbcSupport.*;

/**
 * JDBC implementation of JobRunHistoryRepository.
 * Completion updates the history row and the owning job on one connection
 * and commits once.
 */
public class JdbcJobRunHistoryRepository implements JobRunHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRunHistoryRepository.class);

    private final Database db;

    public JdbcJobRunHistoryRepository(Database db) {
        this.db = db;
    }

    @Override
    public void start(JobRunHistory run) {
        String sql = """
                    INSERT INTO job_run_history (id, job_id, started_at, status, triggered_by)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, run.id());
            ps.setString(2, run.jobId());
            setTimestamp(ps, 3, run.startedAt());
            ps.setString(4, run.status().name());
            ps.setString(5, run.triggeredBy());

            ps.executeUpdate();
            conn.commit();

            log.debug("Opened run {} for job {}", run.id(), run.jobId());
        } catch (SQLException e) {
            throw new StoreException("Failed to open run for job: " + run.jobId(), e);
        }
    }

    @Override
    public boolean complete(RunCompletion completion) {
        // completed_at IS NULL keeps a finalised row immutable
        String runSql = """
                    UPDATE job_run_history
                    SET completed_at = ?, status = ?, output = ?, error_message = ?
                    WHERE id = ? AND completed_at IS NULL
                """;

        String jobSql = """
                    UPDATE scheduled_jobs
                    SET last_run = ?,
                        last_status = ?,
                        last_output = ?,
                        last_error = ?,
                        next_run = ?,
                        run_count = COALESCE(run_count, 0) + 1,
                        success_count = COALESCE(success_count, 0) + ?,
                        claimed_until = NULL,
                        claimed_by = NULL,
                        updated_at = ?
                    WHERE job_id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int finalised;
                try (PreparedStatement ps = conn.prepareStatement(runSql)) {
                    setTimestamp(ps, 1, completion.completedAt());
                    ps.setString(2, completion.status().name());
                    ps.setString(3, completion.output());
                    ps.setString(4, completion.error());
                    ps.setString(5, completion.runId());
                    finalised = ps.executeUpdate();
                }

                if (finalised == 0) {
                    conn.rollback();
                    log.warn("Run {} not found or already finalised", completion.runId());
                    return false;
                }

                try (PreparedStatement ps = conn.prepareStatement(jobSql)) {
                    setTimestamp(ps, 1, completion.completedAt());
                    ps.setString(2, completion.status().name());
                    ps.setString(3, completion.output());
                    ps.setString(4, completion.error());
                    setTimestamp(ps, 5, completion.nextRun());
                    ps.setInt(6, completion.status().countsAsSuccess() ? 1 : 0);
                    setTimestamp(ps, 7, completion.completedAt());
                    ps.setString(8, completion.jobId());
                    ps.executeUpdate();
                }

                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to complete run: " + completion.runId(), e);
        }
    }

    @Override
    public Optional<JobRunHistory> findById(String runId) {
        String sql = "SELECT * FROM job_run_history WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new StoreException("Failed to find run: " + runId, e);
        }
    }

    @Override
    public List<JobRunHistory> findByJobId(String jobId) {
        String sql = "SELECT * FROM job_run_history WHERE job_id = ? ORDER BY started_at DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find runs for job: " + jobId, e);
        }
    }

    @Override
    public List<JobRunHistory> findStaleRunning(Instant startedBefore) {
        String sql = """
                    SELECT * FROM job_run_history
                    WHERE status = 'RUNNING' AND completed_at IS NULL AND started_at < ?
                    ORDER BY started_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, startedBefore);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find stale runs", e);
        }
    }

    @Override
    public String generateId() {
        return "run-" + UUID.randomUUID();
    }

    // --- Helpers ---

    private List<JobRunHistory> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobRunHistory> runs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                runs.add(mapRow(rs));
            }
        }
        return runs;
    }

    private JobRunHistory mapRow(ResultSet rs) throws SQLException {
        RunStatus status = RunStatus.fromDb(rs.getString("status"));
        return JobRunHistory.builder()
                .id(rs.getString("id"))
                .jobId(rs.getString("job_id"))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .status(status != null ? status : RunStatus.ERROR)
                .output(rs.getString("output"))
                .errorMessage(rs.getString("error_message"))
                .triggeredBy(rs.getString("triggered_by"))
                .build();
    }
}
