package work.lcod.taskgen.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.model.Pipeline;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.model.PipelineStructure;
import work.lcod.taskgen.model.Task;

/**
 * Everything one invocation produces, in apply order: resources, tasks, pipeline, then the run built
 * from them. Both generation paths end here.
 */
public record CrdGraph(
    Pipeline pipeline,
    List<Task> tasks,
    List<PipelineResource> resources,
    Optional<PipelineStructure> structure,
    List<Param> params,
    Map<String, String> labels
) {
    public CrdGraph {
        tasks = List.copyOf(tasks);
        resources = List.copyOf(resources);
        params = List.copyOf(params);
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }
}
