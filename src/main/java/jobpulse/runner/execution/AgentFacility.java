package jobpulse.runner.execution;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * External autonomous execution facility: accepts a task description and
 * reports success or failure with text output.
 */
public interface AgentFacility {

    /**
     * Run a task to completion or timeout. Implementations must hard-stop
     * the underlying work when the timeout fires.
     *
     * @param task       free-text task description
     * @param agentType  agent identifier from the job
     * @param workingDir directory the agent works in
     * @param timeout    hard limit
     * @return the agent's reply
     * @throws IOException          if the agent cannot be reached or started
     * @throws InterruptedException if interrupted while waiting
     */
    AgentReply run(String task, String agentType, Path workingDir, Duration timeout)
            throws IOException, InterruptedException;

    /**
     * @param success  agent reported success
     * @param output   agent output text
     * @param error    error text, usually only on failure
     * @param timedOut the timeout fired
     */
    record AgentReply(boolean success, String output, String error, boolean timedOut) {
    }
}
