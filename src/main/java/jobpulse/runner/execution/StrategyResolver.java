package jobpulse.runner.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jobpulse.runner.model.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps a job's execution descriptor onto an {@link ExecutionStrategy}.
 * Agent when execution_type is agent and an agent identifier is set;
 * otherwise subprocess when a command is set; otherwise nothing.
 */
public class StrategyResolver {

    private static final Logger log = LoggerFactory.getLogger(StrategyResolver.class);

    private final Path defaultWorkingDirectory;
    private final ObjectMapper mapper;

    public StrategyResolver(Path defaultWorkingDirectory, ObjectMapper mapper) {
        this.defaultWorkingDirectory = defaultWorkingDirectory;
        this.mapper = mapper;
    }

    public Optional<ExecutionStrategy> resolve(ScheduledJob job) {
        Path workdir = workingDirectory(job);

        if (job.runsAsAgent()) {
            return Optional.of(new ExecutionStrategy.Agent(agentTask(job), job.agentType().trim(), workdir));
        }
        if (job.command() != null && !job.command().isBlank()) {
            return Optional.of(new ExecutionStrategy.Subprocess(job.command(), workdir, job.isAdvisory()));
        }
        return Optional.empty();
    }

    private Path workingDirectory(ScheduledJob job) {
        String dir = job.workingDirectory();
        return dir == null || dir.isBlank() ? defaultWorkingDirectory : Path.of(dir.trim());
    }

    /**
     * agent_config.task, else the command text, else a generic instruction.
     */
    String agentTask(ScheduledJob job) {
        String config = job.agentConfig();
        if (config != null && !config.isBlank()) {
            try {
                JsonNode root = mapper.readTree(config);
                JsonNode task = root.path("task");
                if (task.isTextual() && !task.asText().isBlank()) {
                    return task.asText();
                }
            } catch (JsonProcessingException e) {
                log.warn("Job {} has unreadable agent_config, ignoring it: {}", job.name(), e.getOriginalMessage());
            }
        }
        if (job.command() != null && !job.command().isBlank()) {
            return job.command();
        }
        return "Execute job: " + job.name();
    }
}
