package jobpulse.runner.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for the scheduled job runner.
 * Built once at process start and handed to {@link Dependencies}; the
 * {@code withX} methods return modified copies, the instance itself never changes.
 *
 * Sources, later ones winning: defaults, INI file, environment.
 *
 * <pre>
 * [DATABASE]
 * url = jdbc:h2:file:./data/jobpulse;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE
 * pool_size = 2
 *
 * [RUNNER]
 * batch_size = 5
 * staleness_window_minutes = 1440
 * default_timeout_seconds = 300
 * working_directory = /opt/jobs
 * max_output_chars = 10000
 * max_error_chars = 5000
 * claim_grace_seconds = 60
 * stale_run_threshold_minutes = 360
 * triggered_by = scheduler_runner
 *
 * [AGENT]
 * command = claude --print {task} --allowedTools Read,Write,Edit,Bash
 * </pre>
 */
public final class RunnerConfig {

    public static final String DEFAULT_DATABASE_URL =
            "jdbc:h2:file:./data/jobpulse;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    public static final String DEFAULT_AGENT_COMMAND =
            "claude --print {task} --allowedTools Read,Write,Edit,Bash";

    // Database settings
    private final String databaseUrl;
    private final int databasePoolSize;

    // Selection settings
    private final int batchSize;
    private final Duration stalenessWindow;

    // Execution settings
    private final Duration defaultTimeout;
    private final Path defaultWorkingDirectory;
    private final String agentCommand;

    // Ledger settings
    private final int maxOutputChars;
    private final int maxErrorChars;
    private final String triggeredBy;

    // Claim / monitoring
    private final Duration claimGrace;
    private final Duration staleRunThreshold;

    private RunnerConfig(Builder b) {
        this.databaseUrl = b.databaseUrl;
        this.databasePoolSize = b.databasePoolSize;
        this.batchSize = b.batchSize;
        this.stalenessWindow = b.stalenessWindow;
        this.defaultTimeout = b.defaultTimeout;
        this.defaultWorkingDirectory = b.defaultWorkingDirectory;
        this.agentCommand = b.agentCommand;
        this.maxOutputChars = b.maxOutputChars;
        this.maxErrorChars = b.maxErrorChars;
        this.triggeredBy = b.triggeredBy;
        this.claimGrace = b.claimGrace;
        this.staleRunThreshold = b.staleRunThreshold;
    }

    public static RunnerConfig defaults() {
        return new Builder().build();
    }

    /**
     * Defaults, then the INI file named by JOBPULSE_CONFIG (if any), then the
     * remaining JOBPULSE_* variables.
     */
    public static RunnerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static RunnerConfig fromEnv(Map<String, String> env) {
        return load(null, env);
    }

    /**
     * Defaults, then {@code iniFile} (or the file named by JOBPULSE_CONFIG when
     * null), then the JOBPULSE_* variables.
     */
    public static RunnerConfig load(Path iniFile) {
        return load(iniFile, System.getenv());
    }

    static RunnerConfig load(Path iniFile, Map<String, String> env) {
        RunnerConfig config = defaults();

        Path ini = iniFile;
        String envIni = env.get("JOBPULSE_CONFIG");
        if (ini == null && envIni != null && !envIni.isBlank()) {
            ini = Path.of(envIni.trim());
        }
        if (ini != null) {
            config = config.withIni(ini);
        }
        return config.withEnv(env);
    }

    /**
     * Overlay values from an INI file. Missing sections and keys keep the current values.
     *
     * @throws IllegalArgumentException if the file cannot be read or a value is malformed
     */
    public RunnerConfig withIni(Path file) {
        Ini ini;
        try {
            ini = new Ini(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + file + ": " + e.getMessage(), e);
        }

        Builder b = toBuilder();

        Profile.Section db = ini.get("DATABASE");
        if (db != null) {
            b.databaseUrl = text(db, "url", b.databaseUrl);
            b.databasePoolSize = positiveInt(db, "pool_size", b.databasePoolSize);
        }

        Profile.Section runner = ini.get("RUNNER");
        if (runner != null) {
            b.batchSize = positiveInt(runner, "batch_size", b.batchSize);
            b.stalenessWindow = minutes(runner, "staleness_window_minutes", b.stalenessWindow);
            b.defaultTimeout = seconds(runner, "default_timeout_seconds", b.defaultTimeout);
            String workdir = opt(runner, "working_directory");
            if (workdir != null) {
                b.defaultWorkingDirectory = Path.of(workdir);
            }
            b.maxOutputChars = positiveInt(runner, "max_output_chars", b.maxOutputChars);
            b.maxErrorChars = positiveInt(runner, "max_error_chars", b.maxErrorChars);
            b.claimGrace = seconds(runner, "claim_grace_seconds", b.claimGrace);
            b.staleRunThreshold = minutes(runner, "stale_run_threshold_minutes", b.staleRunThreshold);
            b.triggeredBy = text(runner, "triggered_by", b.triggeredBy);
        }

        Profile.Section agent = ini.get("AGENT");
        if (agent != null) {
            b.agentCommand = text(agent, "command", b.agentCommand);
        }

        return b.build();
    }

    RunnerConfig withEnv(Map<String, String> env) {
        Builder b = toBuilder();

        String dbUrl = env.get("JOBPULSE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            b.databaseUrl = dbUrl.trim();
        }

        String batch = env.get("JOBPULSE_BATCH_SIZE");
        if (batch != null && !batch.isBlank()) {
            b.batchSize = parsePositive("JOBPULSE_BATCH_SIZE", batch);
        }

        String workdir = env.get("JOBPULSE_WORKDIR");
        if (workdir != null && !workdir.isBlank()) {
            b.defaultWorkingDirectory = Path.of(workdir.trim());
        }

        String agentCommand = env.get("JOBPULSE_AGENT_COMMAND");
        if (agentCommand != null && !agentCommand.isBlank()) {
            b.agentCommand = agentCommand.trim();
        }

        return b.build();
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration stalenessWindow() {
        return stalenessWindow;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public Path defaultWorkingDirectory() {
        return defaultWorkingDirectory;
    }

    public String agentCommand() {
        return agentCommand;
    }

    public int maxOutputChars() {
        return maxOutputChars;
    }

    public int maxErrorChars() {
        return maxErrorChars;
    }

    public String triggeredBy() {
        return triggeredBy;
    }

    public Duration claimGrace() {
        return claimGrace;
    }

    public Duration staleRunThreshold() {
        return staleRunThreshold;
    }

    // Copy-on-write setters for tests and CLI overrides
    public RunnerConfig withDatabaseUrl(String url) {
        Builder b = toBuilder();
        b.databaseUrl = url;
        return b.build();
    }

    public RunnerConfig withBatchSize(int batchSize) {
        Builder b = toBuilder();
        b.batchSize = requirePositive("batchSize", batchSize);
        return b.build();
    }

    public RunnerConfig withStalenessWindow(Duration window) {
        Builder b = toBuilder();
        b.stalenessWindow = window;
        return b.build();
    }

    public RunnerConfig withDefaultTimeout(Duration timeout) {
        Builder b = toBuilder();
        b.defaultTimeout = timeout;
        return b.build();
    }

    public RunnerConfig withDefaultWorkingDirectory(Path dir) {
        Builder b = toBuilder();
        b.defaultWorkingDirectory = dir;
        return b.build();
    }

    public RunnerConfig withAgentCommand(String command) {
        Builder b = toBuilder();
        b.agentCommand = command;
        return b.build();
    }

    public RunnerConfig withMaxOutputChars(int chars) {
        Builder b = toBuilder();
        b.maxOutputChars = requirePositive("maxOutputChars", chars);
        return b.build();
    }

    public RunnerConfig withMaxErrorChars(int chars) {
        Builder b = toBuilder();
        b.maxErrorChars = requirePositive("maxErrorChars", chars);
        return b.build();
    }

    public RunnerConfig withClaimGrace(Duration grace) {
        Builder b = toBuilder();
        b.claimGrace = grace;
        return b.build();
    }

    public RunnerConfig withStaleRunThreshold(Duration threshold) {
        Builder b = toBuilder();
        b.staleRunThreshold = threshold;
        return b.build();
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", batchSize=" + batchSize +
                ", stalenessWindow=" + stalenessWindow +
                ", defaultTimeout=" + defaultTimeout +
                ", workdir=" + defaultWorkingDirectory +
                '}';
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.databaseUrl = databaseUrl;
        b.databasePoolSize = databasePoolSize;
        b.batchSize = batchSize;
        b.stalenessWindow = stalenessWindow;
        b.defaultTimeout = defaultTimeout;
        b.defaultWorkingDirectory = defaultWorkingDirectory;
        b.agentCommand = agentCommand;
        b.maxOutputChars = maxOutputChars;
        b.maxErrorChars = maxErrorChars;
        b.triggeredBy = triggeredBy;
        b.claimGrace = claimGrace;
        b.staleRunThreshold = staleRunThreshold;
        return b;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String text(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v != null ? v : def;
    }

    private static int positiveInt(Profile.Section s, String key, int def) {
        String v = opt(s, key);
        return v != null ? parsePositive(key, v) : def;
    }

    private static Duration seconds(Profile.Section s, String key, Duration def) {
        String v = opt(s, key);
        return v != null ? Duration.ofSeconds(parsePositive(key, v)) : def;
    }

    private static Duration minutes(Profile.Section s, String key, Duration def) {
        String v = opt(s, key);
        return v != null ? Duration.ofMinutes(parsePositive(key, v)) : def;
    }

    private static int parsePositive(String key, String value) {
        try {
            return requirePositive(key, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    private static int requirePositive(String key, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
        return value;
    }

    private static final class Builder {
        private String databaseUrl = DEFAULT_DATABASE_URL;
        private int databasePoolSize = 2;
        private int batchSize = 5;
        private Duration stalenessWindow = Duration.ofDays(1);
        private Duration defaultTimeout = Duration.ofSeconds(300);
        private Path defaultWorkingDirectory = new File(System.getProperty("user.dir", ".")).toPath();
        private String agentCommand = DEFAULT_AGENT_COMMAND;
        private int maxOutputChars = 10_000;
        private int maxErrorChars = 5_000;
        private String triggeredBy = "scheduler_runner";
        private Duration claimGrace = Duration.ofSeconds(60);
        private Duration staleRunThreshold = Duration.ofHours(6);

        private RunnerConfig build() {
            return new RunnerConfig(this);
        }
    }
}
