package jobpulse.runner.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import jobpulse.runner.config.Dependencies;
import jobpulse.runner.config.RunnerConfig;
import jobpulse.runner.model.ScheduledJob;
import jobpulse.runner.scheduler.CycleAbortedException;
import jobpulse.runner.scheduler.CycleReport;
import jobpulse.runner.scheduler.JobRunSummary;
import jobpulse.runner.scheduler.SchedulerDriver;
import jobpulse.runner.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command-line entry: run due jobs, preview them, force one, or list all.
 *
 * Exit codes: 0 clean cycle (or nothing due, list, dry run); 1 some job
 * ended outside the success set, or --force matched nothing; 2 startup or
 * store failure.
 */
@Command(
        name = "jobpulse",
        mixinStandardHelpOptions = true,
        version = "jobpulse 1.0.0",
        description = "Run scheduled jobs that are due and record their outcome"
)
public class RunnerCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunnerCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_JOB_FAILURES = 1;
    public static final int EXIT_STARTUP_FAILURE = 2;

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneId.systemDefault());

    @Spec
    CommandSpec spec;

    @Option(names = "--dry-run", description = "Show what would run without executing")
    boolean dryRun;

    @Option(names = "--force", paramLabel = "<job-name>", description = "Run a job now regardless of its schedule")
    String force;

    @Option(names = "--list", description = "List all jobs with a command or agent configured")
    boolean list;

    @Option(names = "--json", description = "Print the cycle report as JSON")
    boolean json;

    @Option(names = "--config", paramLabel = "<file>", description = "INI configuration file")
    Path configFile;

    @Option(names = "--db-url", paramLabel = "<jdbc-url>", description = "Override the database URL")
    String databaseUrl;

    @Option(names = "--batch-size", paramLabel = "<n>", description = "Maximum due jobs per invocation")
    Integer batchSize;

    private final Function<RunnerConfig, Dependencies> dependencyFactory;

    public RunnerCommand() {
        this(Dependencies::create);
    }

    public RunnerCommand(Function<RunnerConfig, Dependencies> dependencyFactory) {
        this.dependencyFactory = dependencyFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Dependencies deps;
        try {
            deps = dependencyFactory.apply(buildConfig());
        } catch (StoreException | IllegalArgumentException e) {
            log.error("Startup failed", e);
            err.println("Startup failed: " + e.getMessage());
            return EXIT_STARTUP_FAILURE;
        }

        try (deps) {
            if (list) {
                printJobList(out, deps.jobRepository().findWithExecutionDescriptor());
                return EXIT_OK;
            }
            return force != null ? runForced(out, deps) : runDue(out, deps);
        } catch (CycleAbortedException | StoreException e) {
            log.error("Cycle aborted", e);
            err.println("Cycle aborted: " + e.getMessage());
            return EXIT_STARTUP_FAILURE;
        }
    }

    RunnerConfig buildConfig() {
        RunnerConfig config = RunnerConfig.load(configFile);
        if (databaseUrl != null && !databaseUrl.isBlank()) {
            config = config.withDatabaseUrl(databaseUrl);
        }
        if (batchSize != null) {
            config = config.withBatchSize(batchSize);
        }
        return config;
    }

    private int runDue(PrintWriter out, Dependencies deps) {
        SchedulerDriver driver = deps.driver();

        if (dryRun) {
            List<ScheduledJob> due = driver.preview();
            printPlan(out, due);
            if (!due.isEmpty()) {
                out.println();
                out.println("[DRY RUN] Would execute the above jobs");
            }
            return EXIT_OK;
        }

        CycleReport report = driver.runCycle();
        if (report.isEmpty()) {
            if (json) {
                printJson(out, deps, report);
            } else {
                out.println("No jobs due to run");
            }
            return EXIT_OK;
        }
        printReport(out, deps, report);
        return report.exitCode();
    }

    private int runForced(PrintWriter out, Dependencies deps) {
        SchedulerDriver driver = deps.driver();

        if (dryRun) {
            List<ScheduledJob> jobs = driver.resolveForced(force);
            if (jobs.isEmpty()) {
                out.println("No job found matching '" + force + "'");
                return EXIT_JOB_FAILURES;
            }
            printPlan(out, jobs);
            out.println();
            out.println("[DRY RUN] Would execute the above jobs");
            return EXIT_OK;
        }

        Optional<CycleReport> report = driver.runForced(force);
        if (report.isEmpty()) {
            out.println("No job found matching '" + force + "'");
            return EXIT_JOB_FAILURES;
        }
        printReport(out, deps, report.get());
        return report.get().exitCode();
    }

    // ===== output =====

    private void printPlan(PrintWriter out, List<ScheduledJob> jobs) {
        if (jobs.isEmpty()) {
            out.println("No jobs due to run");
            return;
        }
        out.println("Found " + jobs.size() + " job(s) to run:");
        for (ScheduledJob job : jobs) {
            out.println("  - " + job.name() + " (schedule: " + job.schedule() + ", priority: " + job.priority() + ")");
        }
    }

    private void printReport(PrintWriter out, Dependencies deps, CycleReport report) {
        if (json) {
            printJson(out, deps, report);
            return;
        }

        out.println("Summary");
        for (JobRunSummary r : report.results()) {
            out.println("  " + (r.succeeded() ? "OK  " : "FAIL") + " " + r.jobName() + ": " + r.status()
                    + " (" + seconds(r.duration()) + ") -> Next: " + time(r.nextRun()));
        }
        for (String name : report.skipped()) {
            out.println("  SKIP " + name + ": claimed or already run by another invocation");
        }
        out.println();
        out.println("Total: " + report.succeeded() + " succeeded, " + report.failed() + " failed");
    }

    private void printJson(PrintWriter out, Dependencies deps, CycleReport report) {
        try {
            out.println(deps.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(report));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise cycle report", e);
        }
    }

    private void printJobList(PrintWriter out, List<ScheduledJob> jobs) {
        out.println("Found " + jobs.size() + " jobs with commands:");
        out.println();
        for (ScheduledJob job : jobs) {
            out.println((job.isActive() ? "[active] " : "[paused] ") + job.name());
            out.println("   Type: " + job.triggerType() + " | Schedule: " + job.schedule());
            out.println("   Last: " + (job.lastRun() != null ? TIME.format(job.lastRun()) : "Never")
                    + " (" + (job.lastStatus() != null ? job.lastStatus() : "N/A") + ")"
                    + " | Next: " + (job.nextRun() != null ? TIME.format(job.nextRun()) : "Not set"));
        }
    }

    private static String time(Instant instant) {
        return instant != null ? TIME.format(instant) : "N/A";
    }

    private static String seconds(Duration d) {
        return d != null ? String.format("%.1fs", d.toMillis() / 1000.0) : "-";
    }
}
