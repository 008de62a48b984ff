package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A task reference inside a pipeline, with its resource wiring and parameters.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PipelineTask(String name, TaskRef taskRef, Resources resources, List<Param> params) {
    public PipelineTask {
        params = params == null ? List.of() : List.copyOf(params);
    }

    public PipelineTask withParams(List<Param> value) {
        return new PipelineTask(name, taskRef, resources, value);
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record TaskRef(String name, String kind, String apiVersion) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Resources(List<InputResource> inputs, List<OutputResource> outputs) {
        public Resources {
            inputs = inputs == null ? List.of() : List.copyOf(inputs);
            outputs = outputs == null ? List.of() : List.copyOf(outputs);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record InputResource(String name, String resource, List<String> from) {
        public InputResource {
            from = from == null ? List.of() : List.copyOf(from);
        }
    }

    public record OutputResource(String name, String resource) {}
}
