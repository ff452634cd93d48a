package jobpulse.runner.execution;

import jobpulse.runner.model.RunStatus;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * How a job runs. Exactly one variant is resolved per job; both share the
 * same outward contract.
 */
public sealed interface ExecutionStrategy permits ExecutionStrategy.Subprocess, ExecutionStrategy.Agent {

    /** Exit code that advisory jobs use to report findings */
    int ISSUES_FOUND_EXIT_CODE = 1;

    /**
     * Run and classify. Spawn and communication failures surface as exceptions;
     * the executor turns them into {@link ExecutionError}s.
     */
    ExecutionOutcome execute(ExecutionContext context, Duration timeout) throws IOException, InterruptedException;

    /** One-line description for logs and listings */
    String describe();

    /**
     * Shell command line run in a working directory.
     *
     * @param advisory reviewer/monitor job: exit 1 means ISSUES_FOUND
     */
    record Subprocess(String command, Path workingDirectory, boolean advisory) implements ExecutionStrategy {

        @Override
        public ExecutionOutcome execute(ExecutionContext context, Duration timeout)
                throws IOException, InterruptedException {
            ProcessLauncher.ProcessOutcome p = context.processLauncher()
                    .run(ProcessLauncher.shell(command), workingDirectory, timeout);

            if (p.timedOut()) {
                return new ExecutionOutcome(RunStatus.TIMEOUT, emptyToNull(p.stdout()),
                        timeoutMessage(timeout), null, p.elapsed());
            }
            return new ExecutionOutcome(classify(p.exitCode()), emptyToNull(p.stdout()),
                    emptyToNull(p.stderr()), p.exitCode(), p.elapsed());
        }

        RunStatus classify(int exitCode) {
            if (exitCode == 0) {
                return RunStatus.SUCCESS;
            }
            if (advisory && exitCode == ISSUES_FOUND_EXIT_CODE) {
                return RunStatus.ISSUES_FOUND;
            }
            return RunStatus.FAILED;
        }

        @Override
        public String describe() {
            return "command: " + command;
        }
    }

    /**
     * Task delegated to an autonomous agent.
     */
    record Agent(String task, String agentType, Path workingDirectory) implements ExecutionStrategy {

        @Override
        public ExecutionOutcome execute(ExecutionContext context, Duration timeout)
                throws IOException, InterruptedException {
            long start = System.nanoTime();
            AgentFacility.AgentReply reply = context.agentFacility()
                    .run(task, agentType, workingDirectory, timeout);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            if (reply.timedOut()) {
                return new ExecutionOutcome(RunStatus.TIMEOUT, emptyToNull(reply.output()),
                        timeoutMessage(timeout), null, elapsed);
            }
            RunStatus status = reply.success() ? RunStatus.SUCCESS : RunStatus.FAILED;
            return new ExecutionOutcome(status, emptyToNull(reply.output()), emptyToNull(reply.error()),
                    null, elapsed);
        }

        @Override
        public String describe() {
            return "agent " + agentType + ": " + task;
        }
    }

    private static String timeoutMessage(Duration timeout) {
        return "Job timed out after " + timeout.toSeconds() + " seconds";
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
