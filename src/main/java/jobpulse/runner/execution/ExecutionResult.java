package jobpulse.runner.execution;

import jobpulse.runner.model.RunStatus;

import java.time.Duration;

/**
 * What the executor hands to the run ledger: either the job ran and was
 * classified, or it could not be run. Both expose the same accessors so
 * the ledger does not care which strategy or path produced them.
 */
public sealed interface ExecutionResult permits ExecutionResult.Completed, ExecutionResult.Failed {

    RunStatus status();

    String output();

    String error();

    Duration duration();

    static ExecutionResult completed(ExecutionOutcome outcome) {
        return new Completed(outcome);
    }

    static ExecutionResult failed(ExecutionError error) {
        return new Failed(error);
    }

    record Completed(ExecutionOutcome outcome) implements ExecutionResult {
        @Override
        public RunStatus status() {
            return outcome.status();
        }

        @Override
        public String output() {
            return outcome.output();
        }

        @Override
        public String error() {
            return outcome.error();
        }

        @Override
        public Duration duration() {
            return outcome.duration();
        }
    }

    record Failed(ExecutionError cause) implements ExecutionResult {
        @Override
        public RunStatus status() {
            return RunStatus.ERROR;
        }

        @Override
        public String output() {
            return null;
        }

        @Override
        public String error() {
            return cause.message();
        }

        @Override
        public Duration duration() {
            return cause.duration();
        }
    }
}
