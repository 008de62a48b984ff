package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Side record linking a pipeline run to the stage layout of the declarative pipeline it came from.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineStructure(
    String apiVersion,
    String kind,
    ObjectMeta metadata,
    String pipelineRef,
    String pipelineRunRef,
    List<Stage> stages
) {
    public PipelineStructure {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public static PipelineStructure of(ObjectMeta metadata, String pipelineRef, List<Stage> stages) {
        return new PipelineStructure(
            ApiVersions.STRUCTURE_API_VERSION,
            ApiVersions.KIND_PIPELINE_STRUCTURE,
            metadata,
            pipelineRef,
            null,
            stages
        );
    }

    public String name() {
        return metadata.name();
    }

    public PipelineStructure withMetadata(ObjectMeta value) {
        return new PipelineStructure(apiVersion, kind, value, pipelineRef, pipelineRunRef, stages);
    }

    public PipelineStructure withRefs(String pipelineRefValue, String pipelineRunRefValue) {
        return new PipelineStructure(apiVersion, kind, metadata, pipelineRefValue, pipelineRunRefValue, stages);
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Stage(
        String name,
        int depth,
        String parent,
        String taskRef,
        String previous,
        String next,
        List<String> stages
    ) {
        public Stage {
            stages = stages == null ? List.of() : List.copyOf(stages);
        }
    }
}
