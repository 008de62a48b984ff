package work.lcod.taskgen.syntax;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.taskgen.model.EnvVar;

/**
 * A pipeline written directly as stages rather than as build pack lifecycles.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ParsedPipeline(Agent agent, List<EnvVar> environment, List<Stage> stages) {
    public ParsedPipeline {
        environment = environment == null ? List.of() : List.copyOf(environment);
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    /**
     * Where steps run: a literal image, or the label of a pod template.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Agent(String image, String label) {
        @JsonIgnore
        public boolean isEmpty() {
            return (image == null || image.isBlank()) && (label == null || label.isBlank());
        }
    }

    /**
     * A stage holds either steps (it becomes a task) or nested stages run in order.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Stage(String name, Agent agent, List<EnvVar> environment, List<StageStep> steps, List<Stage> stages) {
        public Stage {
            environment = environment == null ? List.of() : List.copyOf(environment);
            steps = steps == null ? List.of() : List.copyOf(steps);
            stages = stages == null ? List.of() : List.copyOf(stages);
        }

        public static Stage withSteps(String name, StageStep... steps) {
            return new Stage(name, null, List.of(), List.of(steps), List.of());
        }

        public static Stage withStages(String name, Stage... stages) {
            return new Stage(name, null, List.of(), List.of(), List.of(stages));
        }
    }

    /**
     * A single command. Without {@code args} the command is a shell line.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record StageStep(String name, String command, List<String> args, String dir, String image) {
        public StageStep {
            args = args == null ? List.of() : List.copyOf(args);
        }

        public static StageStep sh(String command) {
            return new StageStep(null, command, List.of(), null, null);
        }
    }
}
