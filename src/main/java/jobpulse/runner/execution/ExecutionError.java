package jobpulse.runner.execution;

import java.time.Duration;

/**
 * The job could not be run at all: spawn failure, missing working
 * directory, agent call exception, no resolvable strategy.
 *
 * @param message  text stored as the run's error message
 * @param duration time spent before the failure
 */
public record ExecutionError(String message, Duration duration) {

    static ExecutionError of(Throwable t, Duration duration) {
        String message = t.getMessage();
        if (message == null || message.isBlank()) {
            message = t.getClass().getSimpleName();
        }
        return new ExecutionError(message, duration);
    }
}
