package jobpulse.runner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jobpulse.runner.execution.AgentFacility;
import jobpulse.runner.execution.CommandLineAgentFacility;
import jobpulse.runner.execution.ExecutionContext;
import jobpulse.runner.execution.JobExecutor;
import jobpulse.runner.execution.ProcessLauncher;
import jobpulse.runner.execution.StrategyResolver;
import jobpulse.runner.repository.JobRunHistoryRepository;
import jobpulse.runner.repository.ScheduledJobRepository;
import jobpulse.runner.schedule.NextRunCalculator;
import jobpulse.runner.scheduler.SchedulerDriver;
import jobpulse.runner.service.DueJobSelector;
import jobpulse.runner.service.RunLedger;
import jobpulse.runner.service.StaleRunMonitor;
import jobpulse.runner.store.Database;
import jobpulse.runner.store.JdbcJobRunHistoryRepository;
import jobpulse.runner.store.JdbcScheduledJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all runner dependencies from one immutable config.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(RunnerConfig.fromEnv())) {
 *     CycleReport report = deps.driver().runCycle();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final RunnerConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Database database;
    private final ScheduledJobRepository jobRepository;
    private final JobRunHistoryRepository runRepository;
    private final NextRunCalculator nextRunCalculator;
    private final DueJobSelector selector;
    private final JobExecutor executor;
    private final RunLedger ledger;
    private final StaleRunMonitor staleRunMonitor;
    private final SchedulerDriver driver;

    private Dependencies(RunnerConfig config, Clock clock, AgentFacility agentFacility) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        this.mapper = createMapper();

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcScheduledJobRepository(database);
        this.runRepository = new JdbcJobRunHistoryRepository(database);

        // Execution
        ProcessLauncher launcher = new ProcessLauncher();
        AgentFacility agents = agentFacility != null
                ? agentFacility
                : new CommandLineAgentFacility(config.agentCommand(), launcher);
        this.executor = new JobExecutor(
                new StrategyResolver(config.defaultWorkingDirectory(), mapper),
                new ExecutionContext(launcher, agents),
                config.defaultTimeout());

        // Services
        this.nextRunCalculator = new NextRunCalculator(clock);
        this.selector = new DueJobSelector(jobRepository, config, clock);
        this.ledger = new RunLedger(runRepository, nextRunCalculator, config, clock);
        this.staleRunMonitor = new StaleRunMonitor(runRepository, config, clock);

        this.driver = new SchedulerDriver(selector, executor, ledger, staleRunMonitor, jobRepository, config, clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     *
     * @throws jobpulse.runner.store.StoreException if the database cannot be opened
     */
    public static Dependencies create(RunnerConfig config) {
        return new Dependencies(config, Clock.systemUTC(), null);
    }

    /**
     * Create dependencies with a specific clock and agent facility (tests).
     */
    public static Dependencies create(RunnerConfig config, Clock clock, AgentFacility agentFacility) {
        return new Dependencies(config, clock, agentFacility);
    }

    /**
     * Jackson mapper shared by agent_config parsing and JSON reports.
     */
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    // Getters
    public RunnerConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public Database database() {
        return database;
    }

    public ScheduledJobRepository jobRepository() {
        return jobRepository;
    }

    public JobRunHistoryRepository runRepository() {
        return runRepository;
    }

    public NextRunCalculator nextRunCalculator() {
        return nextRunCalculator;
    }

    public DueJobSelector selector() {
        return selector;
    }

    public JobExecutor executor() {
        return executor;
    }

    public RunLedger ledger() {
        return ledger;
    }

    public StaleRunMonitor staleRunMonitor() {
        return staleRunMonitor;
    }

    public SchedulerDriver driver() {
        return driver;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
