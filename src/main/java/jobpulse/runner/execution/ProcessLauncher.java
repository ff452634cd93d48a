package jobpulse.runner.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Spawns an external process, drains stdout and stderr on their own threads
 * and enforces a hard timeout. On timeout the process and all its
 * descendants are killed.
 */
public class ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessLauncher.class);

    /** Default in-memory capture limit per stream */
    public static final int DEFAULT_CAPTURE_CHARS = 1_000_000;

    private static final long DRAIN_WAIT_MS = 5_000;

    private final int captureChars;

    public ProcessLauncher(int captureChars) {
        this.captureChars = captureChars;
    }

    public ProcessLauncher() {
        this(DEFAULT_CAPTURE_CHARS);
    }

    /**
     * Wrap a command line for the platform shell.
     */
    public static List<String> shell(String commandLine) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.startsWith("windows")) {
            return List.of("cmd.exe", "/c", commandLine);
        }
        return List.of("/bin/sh", "-c", commandLine);
    }

    /**
     * Run a process to completion or timeout.
     *
     * @param argv       program and arguments
     * @param workingDir directory to run in; must exist
     * @param timeout    hard limit on wall-clock time
     * @return exit status and captured text
     * @throws IOException          if the working directory is missing or the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ProcessOutcome run(List<String> argv, Path workingDir, Duration timeout)
            throws IOException, InterruptedException {
        if (!Files.isDirectory(workingDir)) {
            throw new IOException("Working directory does not exist: " + workingDir);
        }

        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.directory(workingDir.toFile());

        long startNanos = System.nanoTime();
        Process process = pb.start();
        process.getOutputStream().close();

        StreamCollector stdout = new StreamCollector(process.getInputStream(), captureChars);
        StreamCollector stderr = new StreamCollector(process.getErrorStream(), captureChars);
        Thread outThread = startDaemon(stdout, "jobpulse-stdout-" + process.pid());
        Thread errThread = startDaemon(stderr, "jobpulse-stderr-" + process.pid());

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        }

        if (!finished) {
            log.warn("Process {} exceeded {}s, terminating", process.pid(), timeout.toSeconds());
            kill(process);
        }

        drain(outThread, process.getInputStream());
        drain(errThread, process.getErrorStream());

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        int exitCode = finished ? process.exitValue() : -1;

        return new ProcessOutcome(exitCode, stdout.text(), stderr.text(), !finished, elapsed);
    }

    private static Thread startDaemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(DRAIN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Process {} did not exit after forced termination", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Wait for a reader thread to reach EOF. A background grandchild can hold
     * the pipe open after the main process exits; closing the stream unblocks the reader.
     */
    private static void drain(Thread reader, InputStream stream) throws InterruptedException {
        reader.join(DRAIN_WAIT_MS);
        if (reader.isAlive()) {
            try {
                stream.close();
            } catch (IOException e) {
                log.debug("Closing process stream failed: {}", e.getMessage());
            }
            reader.join(DRAIN_WAIT_MS);
        }
    }

    /**
     * Captured result of one process run.
     *
     * @param exitCode process exit code, -1 when killed on timeout
     * @param stdout   captured standard output
     * @param stderr   captured standard error
     * @param timedOut true if the timeout fired
     * @param elapsed  wall-clock time
     */
    public record ProcessOutcome(int exitCode, String stdout, String stderr, boolean timedOut, Duration elapsed) {
    }

    /**
     * Reads a stream to EOF, keeping at most {@code limit} characters.
     */
    private static final class StreamCollector implements Runnable {
        private final InputStream in;
        private final int limit;
        private final StringBuilder buffer = new StringBuilder();
        private boolean truncated;

        StreamCollector(InputStream in, int limit) {
            this.in = in;
            this.limit = limit;
        }

        @Override
        public void run() {
            char[] chunk = new char[8192];
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                int n;
                while ((n = reader.read(chunk)) != -1) {
                    append(chunk, n);
                }
            } catch (IOException e) {
                // stream closed after timeout or by drain()
                log.debug("Process stream closed: {}", e.getMessage());
            }
        }

        private synchronized void append(char[] chunk, int n) {
            int room = limit - buffer.length();
            if (room > 0) {
                buffer.append(chunk, 0, Math.min(room, n));
            }
            if (n > room) {
                truncated = true;
            }
        }

        synchronized String text() {
            return truncated ? buffer + "\n... (truncated)" : buffer.toString();
        }
    }
}
