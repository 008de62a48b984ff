package work.lcod.taskgen.cluster;

import work.lcod.taskgen.model.Pipeline;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.model.PipelineRun;
import work.lcod.taskgen.model.PipelineStructure;
import work.lcod.taskgen.model.Task;

/**
 * Resource store of the execution cluster. Create-or-update calls are idempotent for identical content;
 * every call returns the object as stored, which may carry a server-assigned uid.
 */
public interface ClusterClient {
    PipelineResource createOrUpdateResource(String namespace, PipelineResource resource);

    Task createOrUpdateTask(String namespace, Task task);

    Pipeline createOrUpdatePipeline(String namespace, Pipeline pipeline);

    PipelineRun createPipelineRun(String namespace, PipelineRun run);

    PipelineStructure createPipelineStructure(String namespace, PipelineStructure structure);
}
