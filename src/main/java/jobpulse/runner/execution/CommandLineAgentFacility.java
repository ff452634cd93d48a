package jobpulse.runner.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Agent facility backed by an agent CLI, e.g.
 * {@code claude --print {task} --allowedTools Read,Write,Edit,Bash}.
 *
 * The template is split on whitespace; {@code {task}} and {@code {agent}}
 * are substituted inside each argument, so the task always travels as a
 * single argv element and never through a shell.
 */
public class CommandLineAgentFacility implements AgentFacility {

    private static final Logger log = LoggerFactory.getLogger(CommandLineAgentFacility.class);

    private final String template;
    private final ProcessLauncher launcher;

    public CommandLineAgentFacility(String template, ProcessLauncher launcher) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Agent command template is empty");
        }
        if (!template.contains("{task}")) {
            throw new IllegalArgumentException("Agent command template must contain {task}: " + template);
        }
        this.template = template.trim();
        this.launcher = launcher;
    }

    @Override
    public AgentReply run(String task, String agentType, Path workingDir, Duration timeout)
            throws IOException, InterruptedException {
        List<String> argv = buildArgv(task, agentType);
        log.debug("Launching agent {} via {}", agentType, argv.get(0));

        ProcessLauncher.ProcessOutcome outcome = launcher.run(argv, workingDir, timeout);
        if (outcome.timedOut()) {
            return new AgentReply(false, outcome.stdout(), outcome.stderr(), true);
        }

        boolean success = outcome.exitCode() == 0;
        return new AgentReply(success, outcome.stdout(), success ? null : outcome.stderr(), false);
    }

    List<String> buildArgv(String task, String agentType) {
        List<String> argv = new ArrayList<>();
        for (String token : template.split("\\s+")) {
            argv.add(token
                    .replace("{task}", task)
                    .replace("{agent}", agentType != null ? agentType : ""));
        }
        return argv;
    }
}
