package jobpulse.runner.execution;

import jobpulse.runner.model.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs one job to completion or timeout and classifies the result.
 * Never throws and never touches persistent state; every failure becomes
 * an {@link ExecutionResult.Failed} so one broken job cannot stop the cycle.
 */
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final StrategyResolver resolver;
    private final ExecutionContext context;
    private final Duration defaultTimeout;

    public JobExecutor(StrategyResolver resolver, ExecutionContext context, Duration defaultTimeout) {
        this.resolver = resolver;
        this.context = context;
        this.defaultTimeout = defaultTimeout;
    }

    public ExecutionResult execute(ScheduledJob job) {
        long start = System.nanoTime();
        try {
            Optional<ExecutionStrategy> strategy = resolver.resolve(job);
            if (strategy.isEmpty()) {
                log.warn("Job {} has neither a command nor an agent configured", job.name());
                return ExecutionResult.failed(new ExecutionError("No command or agent configured", elapsed(start)));
            }

            Duration timeout = timeoutFor(job);
            log.info("Running job {} ({}), timeout {}s", job.name(), strategy.get().describe(), timeout.toSeconds());

            ExecutionOutcome outcome = strategy.get().execute(context, timeout);
            log.info("Job {} finished: {} in {}ms", job.name(), outcome.status(), outcome.duration().toMillis());
            return ExecutionResult.completed(outcome);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Job {} interrupted", job.name());
            return ExecutionResult.failed(new ExecutionError("Interrupted while running job", elapsed(start)));
        } catch (Exception e) {
            log.error("Job {} could not be executed: {}", job.name(), e.getMessage(), e);
            return ExecutionResult.failed(ExecutionError.of(e, elapsed(start)));
        }
    }

    /** timeout_seconds when positive, otherwise the configured default */
    public Duration timeoutFor(ScheduledJob job) {
        Integer seconds = job.timeoutSeconds();
        return seconds != null && seconds > 0 ? Duration.ofSeconds(seconds) : defaultTimeout;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
