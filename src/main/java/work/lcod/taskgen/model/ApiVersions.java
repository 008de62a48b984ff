package work.lcod.taskgen.model;

/**
 * API groups and kinds stamped on generated objects.
 */
public final class ApiVersions {
    public static final String PIPELINE_API_VERSION = "tekton.dev/v1alpha1";
    public static final String STRUCTURE_API_VERSION = "jenkins.io/v1";

    public static final String KIND_TASK = "Task";
    public static final String KIND_PIPELINE = "Pipeline";
    public static final String KIND_PIPELINE_RUN = "PipelineRun";
    public static final String KIND_PIPELINE_RESOURCE = "PipelineResource";
    public static final String KIND_PIPELINE_STRUCTURE = "PipelineStructure";

    public static final String RESOURCE_TYPE_GIT = "git";
    public static final String RESOURCE_TYPE_IMAGE = "image";

    private ApiVersions() {}
}
