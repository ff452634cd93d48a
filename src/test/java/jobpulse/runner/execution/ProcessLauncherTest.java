package jobpulse.runner.execution;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class ProcessLauncherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path workdir;

    private final ProcessLauncher launcher = new ProcessLauncher();

    @Test
    void capturesStdoutAndExitCode() throws Exception {
        ProcessLauncher.ProcessOutcome outcome = launcher.run(
                ProcessLauncher.shell("echo hello; echo oops >&2; exit 3"), workdir, TIMEOUT);

        assertFalse(outcome.timedOut());
        assertEquals(3, outcome.exitCode());
        assertEquals("hello\n", outcome.stdout());
        assertEquals("oops\n", outcome.stderr());
    }

    @Test
    void runsInWorkingDirectory() throws Exception {
        Files.writeString(workdir.resolve("marker.txt"), "found");

        ProcessLauncher.ProcessOutcome outcome = launcher.run(
                ProcessLauncher.shell("cat marker.txt"), workdir, TIMEOUT);

        assertEquals(0, outcome.exitCode());
        assertEquals("found", outcome.stdout());
    }

    @Test
    void killsProcessOnTimeout() throws Exception {
        ProcessLauncher.ProcessOutcome outcome = launcher.run(
                ProcessLauncher.shell("echo started; sleep 30"), workdir, Duration.ofMillis(500));

        assertTrue(outcome.timedOut());
        assertEquals(-1, outcome.exitCode());
        assertEquals("started\n", outcome.stdout());
        assertTrue(outcome.elapsed().compareTo(Duration.ofSeconds(20)) < 0);
    }

    @Test
    void largeOutputDoesNotBlockTheChild() throws Exception {
        // well beyond a pipe buffer on both streams
        ProcessLauncher.ProcessOutcome outcome = launcher.run(
                ProcessLauncher.shell("i=0; while [ $i -lt 20000 ]; do echo line-$i; echo err-$i >&2; i=$((i+1)); done"),
                workdir, Duration.ofSeconds(30));

        assertFalse(outcome.timedOut());
        assertEquals(0, outcome.exitCode());
        assertTrue(outcome.stdout().contains("line-19999"));
        assertTrue(outcome.stderr().contains("err-19999"));
    }

    @Test
    void captureLimitTruncates() throws Exception {
        ProcessLauncher small = new ProcessLauncher(10);

        ProcessLauncher.ProcessOutcome outcome = small.run(
                ProcessLauncher.shell("echo 0123456789abcdef"), workdir, TIMEOUT);

        assertTrue(outcome.stdout().startsWith("0123456789"));
        assertTrue(outcome.stdout().endsWith("(truncated)"));
    }

    @Test
    void missingWorkingDirectoryFails() {
        Path missing = workdir.resolve("does-not-exist");

        IOException e = assertThrows(IOException.class,
                () -> launcher.run(ProcessLauncher.shell("true"), missing, TIMEOUT));
        assertTrue(e.getMessage().contains("does-not-exist"));
    }

    @Test
    void unknownProgramFails() {
        assertThrows(IOException.class,
                () -> launcher.run(java.util.List.of("definitely-not-a-real-binary-xyz"), workdir, TIMEOUT));
    }
}
