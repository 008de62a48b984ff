package work.lcod.taskgen.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import work.lcod.taskgen.model.ObjectMeta;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.model.Pipeline;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.model.PipelineRun;
import work.lcod.taskgen.model.PipelineStructure;
import work.lcod.taskgen.model.Task;

/**
 * Objects produced by a generation run, as applied to the cluster (or as they would have been).
 */
public record CreateTaskResults(
    Pipeline pipeline,
    List<Task> tasks,
    List<PipelineResource> resources,
    PipelineRun pipelineRun,
    Optional<PipelineStructure> structure,
    List<Param> pipelineParams,
    Set<String> missingPodTemplates,
    boolean applied
) {
    public CreateTaskResults {
        tasks = List.copyOf(tasks);
        resources = List.copyOf(resources);
        pipelineParams = List.copyOf(pipelineParams);
        missingPodTemplates = Collections.unmodifiableSet(new TreeSet<>(missingPodTemplates));
    }

    /**
     * References to the tasks, the pipeline and the run, in that order.
     */
    public List<ObjectReference> objectReferences() {
        var references = new ArrayList<ObjectReference>();
        for (Task task : tasks) {
            references.add(ObjectReference.of(task.apiVersion(), task.kind(), task.metadata()));
        }
        if (pipeline != null) {
            references.add(ObjectReference.of(pipeline.apiVersion(), pipeline.kind(), pipeline.metadata()));
        }
        if (pipelineRun != null) {
            references.add(ObjectReference.of(pipelineRun.apiVersion(), pipelineRun.kind(), pipelineRun.metadata()));
        }
        return references;
    }

    public record ObjectReference(String apiVersion, String kind, String namespace, String name) {
        static ObjectReference of(String apiVersion, String kind, ObjectMeta metadata) {
            return new ObjectReference(apiVersion, kind, metadata.namespace(), metadata.name());
        }
    }
}
