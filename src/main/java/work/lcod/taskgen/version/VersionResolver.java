package work.lcod.taskgen.version;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.taskgen.compile.CommandText;
import work.lcod.taskgen.config.ConfigException;
import work.lcod.taskgen.config.PipelineConfig;
import work.lcod.taskgen.config.PipelineKind;
import work.lcod.taskgen.config.PipelineLifecycles;
import work.lcod.taskgen.config.PipelineStep;
import work.lcod.taskgen.model.Param;

/**
 * Determines the {@code version} of a release (by running its setversion steps locally) or the
 * {@code preview_version} of any other pipeline.
 */
public final class VersionResolver {
    public static final String VERSION_PARAM = "version";
    public static final String PREVIEW_VERSION_PARAM = "preview_version";
    public static final String VERSION_FILE = "VERSION";
    static final String EXCLUDED_WHEN = "!prow";

    private static final Logger log = LoggerFactory.getLogger(VersionResolver.class);

    private final CommandRunner commandRunner;

    public VersionResolver(CommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    public VersionResolution resolve(PipelineConfig config, PipelineKind kind, VersionRequest request) {
        if (request.noSetVersion() || request.viewSteps()) {
            return VersionResolution.none();
        }
        if (kind == PipelineKind.RELEASE) {
            return resolveRelease(config, request);
        }
        String branch = request.branch();
        if (branch == null || branch.isBlank()) {
            branch = request.revision();
        }
        String previewVersion = "0.0.0-SNAPSHOT-" + branch + "-" + request.buildNumber();
        return new VersionResolution(List.of(new Param(PREVIEW_VERSION_PARAM, previewVersion)), Optional.empty());
    }

    private VersionResolution resolveRelease(PipelineConfig config, VersionRequest request) {
        PipelineLifecycles release;
        try {
            release = config.lifecycles(PipelineKind.RELEASE);
        } catch (ConfigException ex) {
            throw new MissingVersionStageException("No Release pipeline available");
        }
        if (release.setVersion() == null) {
            throw new MissingVersionStageException("No SetVersion pipeline on the Release pipeline");
        }
        invokeSteps(release.setVersion().steps(), request.projectDir());

        Path versionFile = request.projectDir().resolve(VERSION_FILE);
        if (!Files.isRegularFile(versionFile)) {
            return VersionResolution.none();
        }
        String version;
        try {
            version = Files.readString(versionFile, StandardCharsets.UTF_8).trim();
        } catch (IOException ex) {
            throw new ConfigException("Failed to read file " + versionFile, ex);
        }
        if (version.isEmpty()) {
            log.warn("Version file {} is empty; the release continues without a version parameter", versionFile);
            return VersionResolution.none();
        }
        return new VersionResolution(List.of(new Param(VERSION_PARAM, version)), Optional.of("v" + version));
    }

    /**
     * Children of a step run before the step's own command; the next sibling runs after both.
     */
    private void invokeSteps(List<PipelineStep> steps, Path dir) {
        for (PipelineStep step : steps) {
            if (step == null) {
                continue;
            }
            if (!step.steps().isEmpty()) {
                invokeSteps(step.steps(), dir);
            }
            String when = step.when() == null ? "" : step.when().trim();
            if (EXCLUDED_WHEN.equals(when) || !step.hasCommand()) {
                continue;
            }
            runStepCommand(step, dir);
        }
    }

    private void runStepCommand(PipelineStep step, Path dir) {
        String command = CommandText.unescape(step.command());
        log.info("running command: {}", command);
        try {
            String output = commandRunner.run(command, dir);
            if (output != null && !output.isBlank()) {
                log.info("{}", output.strip());
            }
        } catch (IOException ex) {
            throw new CommandExecutionException(
                command,
                "Failed to run setversion command '" + command + "' in " + dir + ": " + ex.getMessage(),
                ex
            );
        }
    }
}
