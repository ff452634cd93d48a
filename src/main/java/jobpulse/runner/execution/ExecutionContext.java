package jobpulse.runner.execution;

/**
 * Collaborators the strategies run against.
 */
public record ExecutionContext(ProcessLauncher processLauncher, AgentFacility agentFacility) {
}
