package work.lcod.taskgen.cluster;

import java.util.List;
import java.util.Optional;
import work.lcod.taskgen.model.Pipeline;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.model.PipelineRun;
import work.lcod.taskgen.model.PipelineStructure;
import work.lcod.taskgen.model.Task;

public record ApplyResults(
    Pipeline pipeline,
    List<Task> tasks,
    List<PipelineResource> resources,
    PipelineRun pipelineRun,
    Optional<PipelineStructure> structure
) {
    public ApplyResults {
        tasks = List.copyOf(tasks);
        resources = List.copyOf(resources);
    }
}
