package jobpulse.runner.service;

import jobpulse.runner.config.RunnerConfig;
import jobpulse.runner.execution.ExecutionError;
import jobpulse.runner.execution.ExecutionOutcome;
import jobpulse.runner.execution.ExecutionResult;
import jobpulse.runner.model.JobRunHistory;
import jobpulse.runner.model.RunCompletion;
import jobpulse.runner.model.RunStatus;
import jobpulse.runner.model.ScheduledJob;
import jobpulse.runner.schedule.NextRunCalculator;
import jobpulse.runner.store.Database;
import jobpulse.runner.store.JdbcJobRunHistoryRepository;
import jobpulse.runner.store.JdbcScheduledJobRepository;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RunLedgerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00.123456789Z");
    private static final Instant NOW_MILLIS = Instant.parse("2026-03-10T12:00:00.123Z");

    private static RunnerConfig config;
    private static Database db;
    private static JdbcScheduledJobRepository jobs;
    private static JdbcJobRunHistoryRepository runs;

    private RunLedger ledger;

    @BeforeAll
    static void setup() {
        config = RunnerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-ledger;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withMaxOutputChars(20)
                .withMaxErrorChars(10);
        db = new Database(config);
        jobs = new JdbcScheduledJobRepository(db);
        runs = new JdbcJobRunHistoryRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_run_history");
            st.execute("DELETE FROM scheduled_jobs");
            conn.commit();
        }
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ledger = new RunLedger(runs, new NextRunCalculator(clock), config, clock);
    }

    @Test
    void openWritesRunningRow() {
        ScheduledJob job = saveJob("daily");

        JobRunHistory run = ledger.open(job, "scheduler_runner");

        JobRunHistory stored = runs.findById(run.id()).orElseThrow();
        assertEquals(RunStatus.RUNNING, stored.status());
        assertEquals(NOW_MILLIS, stored.startedAt());
        assertNull(stored.completedAt());
        assertEquals("scheduler_runner", stored.triggeredBy());
    }

    @Test
    void closeRecordsOutcomeAndSchedulesNextRun() {
        ScheduledJob job = saveJob("daily");
        JobRunHistory run = ledger.open(job, "scheduler_runner");

        RunCompletion completion = ledger.close(run, job, completed(RunStatus.SUCCESS, "ok", null));

        assertEquals(NOW_MILLIS, completion.completedAt());
        assertEquals(NOW_MILLIS.plus(Duration.ofDays(1)), completion.nextRun());

        ScheduledJob updated = jobs.findById(job.id()).orElseThrow();
        assertEquals(NOW_MILLIS, updated.lastRun());
        assertEquals(NOW_MILLIS.plus(Duration.ofDays(1)), updated.nextRun());
        assertEquals(RunStatus.SUCCESS, updated.lastStatus());
        assertEquals(1, updated.runCount());
        assertEquals(1, updated.successCount());

        JobRunHistory finished = runs.findById(run.id()).orElseThrow();
        assertTrue(finished.isFinished());
        assertFalse(finished.completedAt().isBefore(finished.startedAt()));
    }

    @Test
    void outputAndErrorAreBounded() {
        ScheduledJob job = saveJob("hourly");
        JobRunHistory run = ledger.open(job, "scheduler_runner");

        RunCompletion completion = ledger.close(run, job,
                completed(RunStatus.FAILED, "x".repeat(500), "e".repeat(500)));

        assertEquals(20, completion.output().length());
        assertEquals(10, completion.error().length());
        JobRunHistory stored = runs.findById(run.id()).orElseThrow();
        assertEquals(20, stored.output().length());
        assertEquals(10, stored.errorMessage().length());
    }

    @Test
    void unparsableScheduleClearsNextRun() {
        ScheduledJob job = saveJob("at midnight");
        JobRunHistory run = ledger.open(job, "scheduler_runner");

        RunCompletion completion = ledger.close(run, job, completed(RunStatus.SUCCESS, "ok", null));

        assertNull(completion.nextRun());
        ScheduledJob updated = jobs.findById(job.id()).orElseThrow();
        assertNull(updated.nextRun());
        assertEquals(NOW_MILLIS, updated.lastRun());
    }

    @Test
    void executionErrorIsRecorded() {
        ScheduledJob job = saveJob("daily");
        JobRunHistory run = ledger.open(job, "force");

        ledger.close(run, job, ExecutionResult.failed(new ExecutionError("spawn failed", Duration.ZERO)));

        ScheduledJob updated = jobs.findById(job.id()).orElseThrow();
        assertEquals(RunStatus.ERROR, updated.lastStatus());
        assertEquals("spawn fail", updated.lastError());
        assertEquals(1, updated.runCount());
        assertEquals(0, updated.successCount());
    }

    @Test
    void closingTwiceLeavesFirstResult() {
        ScheduledJob job = saveJob("daily");
        JobRunHistory run = ledger.open(job, "scheduler_runner");
        ledger.close(run, job, completed(RunStatus.SUCCESS, "first", null));

        ledger.close(run, job, completed(RunStatus.FAILED, "second", "late"));

        assertEquals("first", runs.findById(run.id()).orElseThrow().output());
        assertEquals(1, jobs.findById(job.id()).orElseThrow().runCount());
    }

    private static ExecutionResult completed(RunStatus status, String output, String error) {
        return ExecutionResult.completed(new ExecutionOutcome(status, output, error, 0, Duration.ofMillis(5)));
    }

    private static ScheduledJob saveJob(String schedule) {
        ScheduledJob job = ScheduledJob.builder()
                .id("job-1")
                .name("nightly-scan")
                .command("echo scan")
                .schedule(schedule)
                .build();
        jobs.save(job);
        return job;
    }
}
