package jobpulse.runner.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jobpulse.runner.config.RunnerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; every connection has auto-commit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(RunnerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    /**
     * @throws StoreException if the pool cannot be opened or the schema cannot be created
     */
    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("jobpulse-db-pool");
        hikariConfig.setAutoCommit(false);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            throw new StoreException("Cannot open database " + jdbcUrl + ": " + e.getMessage(), e);
        }

        log.info("Database pool initialized: {}", jdbcUrl);

        try {
            initSchema();
        } catch (StoreException e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- SCHEDULED JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS scheduled_jobs (
                            job_id            VARCHAR(64) PRIMARY KEY,
                            job_name          VARCHAR(256) NOT NULL UNIQUE,
                            job_description   VARCHAR(2048),
                            execution_type    VARCHAR(20) DEFAULT 'subprocess',
                            command           VARCHAR(4096),
                            working_directory VARCHAR(1024),
                            agent_type        VARCHAR(128),
                            agent_config      CLOB,
                            schedule          VARCHAR(128),
                            trigger_type      VARCHAR(64) DEFAULT 'scheduled',
                            timeout_seconds   INT,
                            is_active         BOOLEAN DEFAULT TRUE,
                            priority          INT DEFAULT 5,
                            last_run          TIMESTAMP,
                            next_run          TIMESTAMP,
                            last_status       VARCHAR(20),
                            last_output       CLOB,
                            last_error        CLOB,
                            run_count         INT DEFAULT 0,
                            success_count     INT DEFAULT 0,
                            claimed_until     TIMESTAMP,
                            claimed_by        VARCHAR(64),
                            created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- RUN HISTORY ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_run_history (
                            id             VARCHAR(64) PRIMARY KEY,
                            job_id         VARCHAR(64) NOT NULL REFERENCES scheduled_jobs(job_id),
                            started_at     TIMESTAMP NOT NULL,
                            completed_at   TIMESTAMP,
                            status         VARCHAR(20) NOT NULL,
                            output         CLOB,
                            error_message  CLOB,
                            triggered_by   VARCHAR(64)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_due ON scheduled_jobs(is_active, priority, next_run);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_job_started ON job_run_history(job_id, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_status_started ON job_run_history(status, started_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
