package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OwnerReference(String apiVersion, String kind, String name, String uid) {
    public static OwnerReference toPipeline(Pipeline pipeline) {
        return new OwnerReference(
            ApiVersions.PIPELINE_API_VERSION,
            ApiVersions.KIND_PIPELINE,
            pipeline.metadata().name(),
            pipeline.metadata().uid()
        );
    }
}
