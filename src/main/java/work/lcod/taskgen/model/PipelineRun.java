package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineRun(String apiVersion, String kind, ObjectMeta metadata, Spec spec) {

    public static PipelineRun of(ObjectMeta metadata, Spec spec) {
        return new PipelineRun(ApiVersions.PIPELINE_API_VERSION, ApiVersions.KIND_PIPELINE_RUN, metadata, spec);
    }

    public String name() {
        return metadata.name();
    }

    public PipelineRun withMetadata(ObjectMeta value) {
        return new PipelineRun(apiVersion, kind, value, spec);
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Spec(
        String serviceAccount,
        Trigger trigger,
        PipelineRef pipelineRef,
        List<ResourceBinding> resources,
        List<Param> params
    ) {
        public Spec {
            resources = resources == null ? List.of() : List.copyOf(resources);
            params = params == null ? List.of() : List.copyOf(params);
        }
    }

    public record Trigger(String type) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record PipelineRef(String name, String apiVersion) {}

    public record ResourceBinding(String name, ResourceRef resourceRef) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ResourceRef(String name, String apiVersion) {}
}
