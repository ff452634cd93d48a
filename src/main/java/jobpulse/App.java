package jobpulse;

import jobpulse.runner.cli.RunnerCommand;
import picocli.CommandLine;

/**
 * Process entry point. Invoked periodically by an external timer (cron,
 * systemd timer, Windows Task Scheduler); each invocation runs one cycle.
 */
public final class App {

    private App() {
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RunnerCommand()).execute(args);
        System.exit(exitCode);
    }
}
