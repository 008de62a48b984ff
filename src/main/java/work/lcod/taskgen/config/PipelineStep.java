package work.lcod.taskgen.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A node of a lifecycle step tree. A non-empty command makes it an execution unit; children are
 * compiled after it, inheriting its container and directory unless they override them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PipelineStep(
    String name,
    @JsonAlias("sh") String command,
    String dir,
    String container,
    String when,
    List<PipelineStep> steps
) {
    public PipelineStep {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static PipelineStep command(String name, String command) {
        return new PipelineStep(name, command, null, null, null, List.of());
    }

    public static PipelineStep group(String name, List<PipelineStep> steps) {
        return new PipelineStep(name, null, null, null, null, steps);
    }

    public boolean hasCommand() {
        return command != null && !command.isBlank();
    }
}
