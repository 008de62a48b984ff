package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Pipeline(String apiVersion, String kind, ObjectMeta metadata, Spec spec) {

    public static Pipeline of(ObjectMeta metadata, Spec spec) {
        return new Pipeline(ApiVersions.PIPELINE_API_VERSION, ApiVersions.KIND_PIPELINE, metadata, spec);
    }

    public String name() {
        return metadata.name();
    }

    public Pipeline withMetadata(ObjectMeta value) {
        return new Pipeline(apiVersion, kind, value, spec);
    }

    public Pipeline withSpec(Spec value) {
        return new Pipeline(apiVersion, kind, metadata, value);
    }

    /**
     * Fills in {@code apiVersion} and {@code kind} when a generator left them unset.
     */
    public Pipeline withDefaultTypeMeta() {
        String version = apiVersion == null || apiVersion.isBlank() ? ApiVersions.PIPELINE_API_VERSION : apiVersion;
        String kindValue = kind == null || kind.isBlank() ? ApiVersions.KIND_PIPELINE : kind;
        return new Pipeline(version, kindValue, metadata, spec);
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Spec(List<DeclaredResource> resources, List<PipelineTask> tasks) {
        public Spec {
            resources = resources == null ? List.of() : List.copyOf(resources);
            tasks = tasks == null ? List.of() : List.copyOf(tasks);
        }

        public Spec withTasks(List<PipelineTask> value) {
            return new Spec(resources, value);
        }
    }

    public record DeclaredResource(String name, String type) {}
}
