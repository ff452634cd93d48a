package jobpulse.runner.scheduler;

/**
 * States of one invocation cycle:
 * IDLE -> SELECTING -> (EXECUTING -> FINALIZING)* -> SUMMARIZING -> IDLE.
 */
public enum CyclePhase {
    IDLE,
    SELECTING,
    EXECUTING,
    FINALIZING,
    SUMMARIZING
}
