package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(String apiVersion, String kind, ObjectMeta metadata, Spec spec) {

    public static Task of(ObjectMeta metadata, Spec spec) {
        return new Task(ApiVersions.PIPELINE_API_VERSION, ApiVersions.KIND_TASK, metadata, spec);
    }

    public String name() {
        return metadata.name();
    }

    public Task withMetadata(ObjectMeta value) {
        return new Task(apiVersion, kind, value, spec);
    }

    public Task withSpec(Spec value) {
        return new Task(apiVersion, kind, metadata, value);
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Spec(Inputs inputs, Outputs outputs, List<Container> steps, List<Volume> volumes) {
        public Spec {
            steps = steps == null ? List.of() : List.copyOf(steps);
            volumes = volumes == null ? List.of() : List.copyOf(volumes);
        }

        public Spec withInputs(Inputs value) {
            return new Spec(value, outputs, steps, volumes);
        }

        public Spec withSteps(List<Container> stepsValue, List<Volume> volumesValue) {
            return new Spec(inputs, outputs, stepsValue, volumesValue);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Inputs(List<TaskResource> resources, List<TaskParam> params) {
        public Inputs {
            resources = resources == null ? List.of() : List.copyOf(resources);
            params = params == null ? List.of() : List.copyOf(params);
        }

        public Inputs withParams(List<TaskParam> value) {
            return new Inputs(resources, value);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Outputs(List<TaskResource> resources) {
        public Outputs {
            resources = resources == null ? List.of() : List.copyOf(resources);
        }
    }
}
