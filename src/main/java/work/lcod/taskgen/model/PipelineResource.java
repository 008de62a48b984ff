package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResource(String apiVersion, String kind, ObjectMeta metadata, Spec spec) {

    public static PipelineResource of(ObjectMeta metadata, Spec spec) {
        return new PipelineResource(ApiVersions.PIPELINE_API_VERSION, ApiVersions.KIND_PIPELINE_RESOURCE, metadata, spec);
    }

    public String name() {
        return metadata.name();
    }

    public String type() {
        return spec.type();
    }

    public PipelineResource withMetadata(ObjectMeta value) {
        return new PipelineResource(apiVersion, kind, value, spec);
    }

    public Optional<String> param(String paramName) {
        return spec.params().stream()
            .filter(p -> paramName.equals(p.name()))
            .map(Param::value)
            .findFirst();
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Spec(String type, List<Param> params) {
        public Spec {
            params = params == null ? List.of() : List.copyOf(params);
        }
    }
}
