package jobpulse.runner.store;

import jobpulse.runner.config.RunnerConfig;
import jobpulse.runner.model.ExecutionType;
import jobpulse.runner.model.ScheduledJob;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcScheduledJobRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final Instant STALE_BEFORE = NOW.minus(Duration.ofDays(1));

    private static Database db;
    private static JdbcScheduledJobRepository repo;

    @BeforeAll
    static void setup() {
        RunnerConfig config = RunnerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-jobs;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcScheduledJobRepository(db);
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
    }

    @Test
    void saveAndFindById() {
        Instant created = Instant.parse("2026-01-01T00:00:00Z");
        repo.save(ScheduledJob.builder()
                .id("job-1")
                .name("nightly-scan")
                .description("scan everything")
                .command("echo scan")
                .workingDirectory("/tmp")
                .schedule("daily")
                .timeoutSeconds(120)
                .priority(2)
                .createdAt(created)
                .build());

        Optional<ScheduledJob> found = repo.findById("job-1");
        assertTrue(found.isPresent());
        ScheduledJob job = found.get();
        assertEquals("nightly-scan", job.name());
        assertEquals("scan everything", job.description());
        assertEquals(ExecutionType.SUBPROCESS, job.executionType());
        assertEquals("echo scan", job.command());
        assertEquals("/tmp", job.workingDirectory());
        assertEquals("daily", job.schedule());
        assertEquals(Integer.valueOf(120), job.timeoutSeconds());
        assertEquals(2, job.priority());
        assertTrue(job.isActive());
        assertNull(job.lastRun());
        assertNull(job.nextRun());
        assertEquals(created, job.createdAt());
    }

    @Test
    void findByIdMissing() {
        assertTrue(repo.findById("nope").isEmpty());
    }

    @Test
    void findByNameIgnoresCase() {
        repo.save(job("j1", "Nightly-Scan").build());

        assertTrue(repo.findByName("nightly-scan").isPresent());
        assertTrue(repo.findByName("NIGHTLY-SCAN").isPresent());
        assertTrue(repo.findByName("nightly").isEmpty());
    }

    @Test
    void findByNameLikeMatchesSubstringWithDescriptor() {
        repo.save(job("j1", "db-backup").build());
        repo.save(job("j2", "files-backup").build());
        repo.save(job("j3", "backup-report").command(null).build());
        repo.save(job("j4", "cleanup").build());

        List<ScheduledJob> found = repo.findByNameLike("BACKUP");

        assertEquals(List.of("db-backup", "files-backup"), found.stream().map(ScheduledJob::name).toList());
    }

    @Test
    void findByNameLikeTreatsWildcardsLiterally() {
        repo.save(job("j1", "report_daily").build());
        repo.save(job("j2", "reportXdaily").build());

        List<ScheduledJob> found = repo.findByNameLike("report_");

        assertEquals(1, found.size());
        assertEquals("report_daily", found.get(0).name());
    }

    @Test
    void findWithExecutionDescriptorSkipsEmptyJobs() {
        repo.save(job("j1", "with-command").build());
        repo.save(job("j2", "agent").command(null).executionType(ExecutionType.AGENT).agentType("general").build());
        repo.save(job("j3", "nothing").command(null).build());
        repo.save(job("j4", "paused").active(false).build());

        List<String> names = repo.findWithExecutionDescriptor().stream().map(ScheduledJob::name).toList();

        assertEquals(3, names.size());
        assertTrue(names.containsAll(List.of("with-command", "agent", "paused")));
    }

    // ===== due selection =====

    @Test
    void dueWhenNextRunReached() {
        repo.save(job("past", "past").nextRun(NOW.minusSeconds(60)).lastRun(NOW.minus(Duration.ofHours(2))).build());
        repo.save(job("exact", "exact").nextRun(NOW).lastRun(NOW.minus(Duration.ofHours(2))).build());
        repo.save(job("future", "future").nextRun(NOW.plusSeconds(60)).lastRun(NOW.minusSeconds(10)).build());

        List<String> ids = dueIds(5);

        assertTrue(ids.contains("past"));
        assertTrue(ids.contains("exact"));
        assertFalse(ids.contains("future"));
    }

    @Test
    void neverRunJobIsDue() {
        repo.save(job("fresh", "fresh").build());

        assertEquals(List.of("fresh"), dueIds(5));
    }

    @Test
    void nullNextRunIsDueOnlyWhenLastRunIsStale() {
        repo.save(job("stale", "stale").lastRun(NOW.minus(Duration.ofDays(2))).build());
        repo.save(job("recent", "recent").lastRun(NOW.minus(Duration.ofHours(2))).build());

        assertEquals(List.of("stale"), dueIds(5));
    }

    @Test
    void inactiveJobsAreNeverDue() {
        repo.save(job("paused", "paused").active(false).build());

        assertTrue(dueIds(5).isEmpty());
    }

    @Test
    void onlyScheduleTriggersAreDue() {
        repo.save(job("a", "a").triggerType("scheduled").build());
        repo.save(job("b", "b").triggerType("Schedule").build());
        repo.save(job("c", "c").triggerType("session_start").build());
        repo.save(job("d", "d").triggerType("manual").build());

        List<String> ids = dueIds(5);

        assertEquals(2, ids.size());
        assertTrue(ids.containsAll(List.of("a", "b")));
    }

    @Test
    void jobsWithoutDescriptorAreNeverDue() {
        repo.save(job("none", "none").command(null).build());
        repo.save(job("blank", "blank").command("  ").build());
        repo.save(job("agent-no-type", "agent-no-type").command(null).executionType(ExecutionType.AGENT).build());
        repo.save(job("agent", "agent").command(null).executionType(ExecutionType.AGENT).agentType("general").build());

        assertEquals(List.of("agent"), dueIds(5));
    }

    @Test
    void orderedByPriorityThenNextRunWithNullsFirst() {
        repo.save(job("p2-old", "p2-old").priority(2).nextRun(NOW.minus(Duration.ofHours(3))).build());
        repo.save(job("p1-late", "p1-late").priority(1).nextRun(NOW.minus(Duration.ofMinutes(5))).build());
        repo.save(job("p1-early", "p1-early").priority(1).nextRun(NOW.minus(Duration.ofHours(1))).build());
        repo.save(job("p1-never", "p1-never").priority(1).build());

        assertEquals(List.of("p1-never", "p1-early", "p1-late", "p2-old"), dueIds(5));
    }

    @Test
    void batchCapLimitsSelection() {
        for (int i = 0; i < 8; i++) {
            repo.save(job("job-" + i, "job-" + i).priority(i).nextRun(NOW.minusSeconds(60)).build());
        }

        assertEquals(List.of("job-0", "job-1", "job-2", "job-3", "job-4"), dueIds(5));
        assertEquals(2, dueIds(2).size());
    }

    // ===== claims =====

    @Test
    void claimIsExclusiveUntilExpiry() {
        ScheduledJob j1 = job("j1", "j1").build();
        repo.save(j1);
        Instant until = NOW.plus(Duration.ofMinutes(6));

        assertTrue(repo.tryClaim(j1, "runner-a", NOW, until));
        assertFalse(repo.tryClaim(j1, "runner-b", NOW.plusSeconds(10), until.plusSeconds(10)));

        ScheduledJob claimed = repo.findById("j1").orElseThrow();
        assertEquals("runner-a", claimed.claimedBy());
        assertEquals(until, claimed.claimedUntil());

        // expired claims can be taken over
        assertTrue(repo.tryClaim(j1, "runner-b", until, until.plus(Duration.ofMinutes(6))));
        assertEquals("runner-b", repo.findById("j1").orElseThrow().claimedBy());
    }

    @Test
    void claimFromStaleReadFailsOnceJobHasRun() throws Exception {
        ScheduledJob seen = job("j1", "j1").build();
        repo.save(seen);

        // another invocation ran the job to completion after this one read it
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.executeUpdate("UPDATE scheduled_jobs SET run_count = 1, success_count = 1 WHERE job_id = 'j1'");
            conn.commit();
        }

        assertFalse(repo.tryClaim(seen, "runner-b", NOW.plusSeconds(5), NOW.plus(Duration.ofMinutes(6))));
        assertNull(repo.findById("j1").orElseThrow().claimedBy());

        ScheduledJob fresh = repo.findById("j1").orElseThrow();
        assertTrue(repo.tryClaim(fresh, "runner-b", NOW.plusSeconds(5), NOW.plus(Duration.ofMinutes(6))));
    }

    @Test
    void releaseOnlyDropsOwnClaim() {
        ScheduledJob j1 = job("j1", "j1").build();
        repo.save(j1);
        repo.tryClaim(j1, "runner-a", NOW, NOW.plus(Duration.ofMinutes(6)));

        assertFalse(repo.releaseClaim("j1", "runner-b"));
        assertEquals("runner-a", repo.findById("j1").orElseThrow().claimedBy());

        assertTrue(repo.releaseClaim("j1", "runner-a"));
        ScheduledJob released = repo.findById("j1").orElseThrow();
        assertNull(released.claimedBy());
        assertNull(released.claimedUntil());
        assertEquals(List.of("j1"), dueIds(5));
    }

    @Test
    void claimedJobIsNotDue() {
        repo.save(job("j1", "j1").build());
        repo.save(job("j2", "j2").build());
        repo.tryClaim(repo.findById("j1").orElseThrow(), "runner-a", NOW, NOW.plus(Duration.ofMinutes(5)));

        assertEquals(List.of("j2"), dueIds(5));
    }

    @Test
    void expiredClaimDoesNotHideJob() {
        repo.save(job("j1", "j1").claimedBy("dead-runner").claimedUntil(NOW.minusSeconds(1)).build());

        assertEquals(List.of("j1"), dueIds(5));
    }

    @Test
    void claimUnknownJobFails() {
        assertFalse(repo.tryClaim(job("ghost", "ghost").build(), "runner-a", NOW, NOW.plusSeconds(60)));
    }

    private static List<String> dueIds(int limit) {
        return repo.findDue(NOW, STALE_BEFORE, limit).stream().map(ScheduledJob::id).toList();
    }

    private static ScheduledJob.Builder job(String id, String name) {
        return ScheduledJob.builder()
                .id(id)
                .name(name)
                .command("echo " + name)
                .schedule("daily")
                .createdAt(NOW.minus(30, ChronoUnit.DAYS));
    }
}
