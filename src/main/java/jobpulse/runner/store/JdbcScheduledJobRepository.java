package jobpulse.runner.store;

import jobpulse.runner.model.ExecutionType;
import jobpulse.runner.model.RunStatus;
import jobpulse.runner.model.ScheduledJob;
import jobpulse.runner.repository.ScheduledJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static jobpulse.runner.store.JdbcSupport.*;

/**
 * JDBC implementation of ScheduledJobRepository.
 * Claims use a single conditional UPDATE so only one invocation can win.
 */
public class JdbcScheduledJobRepository implements ScheduledJobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcScheduledJobRepository.class);

    // Same rule as ScheduledJob.hasExecutionDescriptor()
    private static final String HAS_DESCRIPTOR = """
                (
                    (command IS NOT NULL AND TRIM(command) <> '')
                    OR (LOWER(COALESCE(execution_type, 'subprocess')) = 'agent'
                        AND agent_type IS NOT NULL AND TRIM(agent_type) <> '')
                )
            """;

    private final Database db;

    public JdbcScheduledJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(ScheduledJob job) {
        String sql = """
                    INSERT INTO scheduled_jobs (job_id, job_name, job_description, execution_type, command,
                                                working_directory, agent_type, agent_config, schedule, trigger_type,
                                                timeout_seconds, is_active, priority, last_run, next_run, last_status,
                                                last_output, last_error, run_count, success_count, claimed_until,
                                                claimed_by, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.name());
            ps.setString(3, job.description());
            ps.setString(4, job.executionType().dbValue());
            ps.setString(5, job.command());
            ps.setString(6, job.workingDirectory());
            ps.setString(7, job.agentType());
            ps.setString(8, job.agentConfig());
            ps.setString(9, job.schedule());
            ps.setString(10, job.triggerType());
            setIntOrNull(ps, 11, job.timeoutSeconds());
            ps.setBoolean(12, job.isActive());
            ps.setInt(13, job.priority());
            setTimestamp(ps, 14, job.lastRun());
            setTimestamp(ps, 15, job.nextRun());
            ps.setString(16, job.lastStatus() != null ? job.lastStatus().name() : null);
            ps.setString(17, job.lastOutput());
            ps.setString(18, job.lastError());
            ps.setInt(19, job.runCount());
            ps.setInt(20, job.successCount());
            setTimestamp(ps, 21, job.claimedUntil());
            ps.setString(22, job.claimedBy());
            setTimestamp(ps, 23, job.createdAt() != null ? job.createdAt() : now);
            setTimestamp(ps, 24, job.updatedAt() != null ? job.updatedAt() : now);

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved scheduled job: {} ({})", job.name(), job.id());
        } catch (SQLException e) {
            throw new StoreException("Failed to save job: " + job.name(), e);
        }
    }

    @Override
    public Optional<ScheduledJob> findById(String jobId) {
        String sql = "SELECT * FROM scheduled_jobs WHERE job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public Optional<ScheduledJob> findByName(String name) {
        String sql = "SELECT * FROM scheduled_jobs WHERE LOWER(job_name) = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name.trim().toLowerCase(Locale.ROOT));
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new StoreException("Failed to find job by name: " + name, e);
        }
    }

    @Override
    public List<ScheduledJob> findByNameLike(String fragment) {
        String sql = "SELECT * FROM scheduled_jobs WHERE LOWER(job_name) LIKE ? ESCAPE '\\' AND "
                + HAS_DESCRIPTOR + " ORDER BY job_name";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, "%" + escapeLike(fragment.trim().toLowerCase(Locale.ROOT)) + "%");
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find jobs matching: " + fragment, e);
        }
    }

    @Override
    public List<ScheduledJob> findWithExecutionDescriptor() {
        String sql = "SELECT * FROM scheduled_jobs WHERE " + HAS_DESCRIPTOR + " ORDER BY trigger_type, job_name";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs", e);
        }
    }

    @Override
    public List<ScheduledJob> findDue(Instant now, Instant staleBefore, int limit) {
        String sql = """
                    SELECT * FROM scheduled_jobs
                    WHERE is_active = TRUE
                      AND LOWER(trigger_type) IN ('scheduled', 'schedule')
                      AND """ + HAS_DESCRIPTOR + """
                      AND (claimed_until IS NULL OR claimed_until <= ?)
                      AND (
                          next_run <= ?
                          OR (next_run IS NULL AND last_run IS NULL)
                          OR (next_run IS NULL AND last_run < ?)
                      )
                    ORDER BY priority ASC, next_run ASC NULLS FIRST, job_name
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            setTimestamp(ps, 2, now);
            setTimestamp(ps, 3, staleBefore);
            ps.setInt(4, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to select due jobs", e);
        }
    }

    @Override
    public boolean tryClaim(ScheduledJob job, String claimant, Instant now, Instant until) {
        // run_count guard: a completion by another invocation bumps it and clears the claim
        String sql = """
                    UPDATE scheduled_jobs
                    SET claimed_until = ?, claimed_by = ?
                    WHERE job_id = ?
                      AND COALESCE(run_count, 0) = ?
                      AND (claimed_until IS NULL OR claimed_until <= ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, until);
            ps.setString(2, claimant);
            ps.setString(3, job.id());
            ps.setInt(4, job.runCount());
            setTimestamp(ps, 5, now);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to claim job: " + job.id(), e);
        }
    }

    @Override
    public boolean releaseClaim(String jobId, String claimant) {
        String sql = """
                    UPDATE scheduled_jobs
                    SET claimed_until = NULL, claimed_by = NULL
                    WHERE job_id = ? AND claimed_by = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, claimant);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to release claim on job: " + jobId, e);
        }
    }

    // --- Helpers ---

    private List<ScheduledJob> executeQuery(PreparedStatement ps) throws SQLException {
        List<ScheduledJob> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private ScheduledJob mapRow(ResultSet rs) throws SQLException {
        return ScheduledJob.builder()
                .id(rs.getString("job_id"))
                .name(rs.getString("job_name"))
                .description(rs.getString("job_description"))
                .executionType(ExecutionType.fromDb(rs.getString("execution_type")))
                .command(rs.getString("command"))
                .workingDirectory(rs.getString("working_directory"))
                .agentType(rs.getString("agent_type"))
                .agentConfig(rs.getString("agent_config"))
                .schedule(rs.getString("schedule"))
                .triggerType(rs.getString("trigger_type"))
                .timeoutSeconds(getIntOrNull(rs, "timeout_seconds"))
                .active(rs.getBoolean("is_active"))
                .priority(rs.getInt("priority"))
                .lastRun(toInstant(rs.getTimestamp("last_run")))
                .nextRun(toInstant(rs.getTimestamp("next_run")))
                .lastStatus(RunStatus.fromDb(rs.getString("last_status")))
                .lastOutput(rs.getString("last_output"))
                .lastError(rs.getString("last_error"))
                .runCount(rs.getInt("run_count"))
                .successCount(rs.getInt("success_count"))
                .claimedUntil(toInstant(rs.getTimestamp("claimed_until")))
                .claimedBy(rs.getString("claimed_by"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
