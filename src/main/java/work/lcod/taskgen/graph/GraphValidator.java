package work.lcod.taskgen.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.model.Pipeline;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.model.PipelineTask;
import work.lcod.taskgen.model.Task;
import work.lcod.taskgen.model.Volume;
import work.lcod.taskgen.model.VolumeMount;
import work.lcod.taskgen.shared.KubeNames;
import work.lcod.taskgen.shared.ValidationException;

/**
 * Structural checks on generated objects: required fields and references that must resolve.
 */
public final class GraphValidator {

    public void validateTask(Task task) {
        var problems = new ArrayList<String>();
        requireName(task.metadata().name(), "task name", problems);
        if (task.spec() == null || task.spec().steps().isEmpty()) {
            problems.add("a task needs at least one step");
        } else {
            Set<String> stepNames = new HashSet<>();
            Set<String> volumeNames = task.spec().volumes().stream().map(Volume::name).collect(Collectors.toSet());
            for (Container step : task.spec().steps()) {
                String label = "step '" + step.name() + "'";
                if (step.name() == null || step.name().isBlank()) {
                    problems.add("every step needs a name");
                } else if (!stepNames.add(step.name())) {
                    problems.add("duplicate step name " + step.name());
                }
                if (step.image() == null || step.image().isBlank()) {
                    problems.add(label + " has no image");
                }
                if (step.command().isEmpty() && step.args().isEmpty()) {
                    problems.add(label + " has no command");
                }
                for (VolumeMount mount : step.volumeMounts()) {
                    if (!volumeNames.contains(mount.name())) {
                        problems.add(label + " mounts undeclared volume " + mount.name());
                    }
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new ValidationException("generated Task " + task.metadata().name(), problems);
        }
    }

    public void validatePipeline(Pipeline pipeline) {
        var problems = new ArrayList<String>();
        requireName(pipeline.metadata().name(), "pipeline name", problems);
        Set<String> declared = pipeline.spec().resources().stream()
            .map(Pipeline.DeclaredResource::name)
            .collect(Collectors.toSet());
        if (pipeline.spec().tasks().isEmpty()) {
            problems.add("a pipeline needs at least one task");
        }
        Set<String> earlierTasks = new HashSet<>();
        for (PipelineTask task : pipeline.spec().tasks()) {
            String label = "pipeline task '" + task.name() + "'";
            requireName(task.name(), "pipeline task name", problems);
            if (task.taskRef() == null || task.taskRef().name() == null || task.taskRef().name().isBlank()) {
                problems.add(label + " has no task reference");
            }
            if (task.resources() != null) {
                for (PipelineTask.InputResource input : task.resources().inputs()) {
                    if (!declared.contains(input.resource())) {
                        problems.add(label + " uses undeclared resource " + input.resource());
                    }
                    for (String from : input.from()) {
                        if (!earlierTasks.contains(from)) {
                            problems.add(label + " takes " + input.name() + " from " + from + " which does not run before it");
                        }
                    }
                }
                for (PipelineTask.OutputResource output : task.resources().outputs()) {
                    if (!declared.contains(output.resource())) {
                        problems.add(label + " outputs undeclared resource " + output.resource());
                    }
                }
            }
            requireUniqueParams(task.params(), label, problems);
            if (task.name() != null && !earlierTasks.add(task.name())) {
                problems.add("duplicate pipeline task name " + task.name());
            }
        }
        if (!problems.isEmpty()) {
            throw new ValidationException("generated Pipeline " + pipeline.metadata().name(), problems);
        }
    }

    /**
     * Every reference between generated objects resolves to an object of the same graph.
     */
    public void validateGraph(CrdGraph graph) {
        validatePipeline(graph.pipeline());
        graph.tasks().forEach(this::validateTask);

        var problems = new ArrayList<String>();
        Set<String> taskNames = graph.tasks().stream().map(Task::name).collect(Collectors.toSet());
        Set<String> resourceNames = graph.resources().stream().map(PipelineResource::name).collect(Collectors.toSet());
        for (PipelineTask task : graph.pipeline().spec().tasks()) {
            if (task.taskRef() != null && !taskNames.contains(task.taskRef().name())) {
                problems.add("pipeline task '" + task.name() + "' references unknown task " + task.taskRef().name());
            }
        }
        for (Pipeline.DeclaredResource resource : graph.pipeline().spec().resources()) {
            if (!resourceNames.contains(resource.name())) {
                problems.add("pipeline declares resource " + resource.name() + " which is not generated");
            }
        }
        requireUniqueParams(graph.params(), "pipeline parameters", problems);
        if (!problems.isEmpty()) {
            throw new ValidationException("generated graph " + graph.pipeline().metadata().name(), problems);
        }
    }

    private static void requireName(String name, String what, List<String> problems) {
        if (name == null || name.isBlank()) {
            problems.add(what + " is required");
        } else if (!KubeNames.toValidName(name).equals(name)) {
            problems.add(what + " '" + name + "' is not a valid object name");
        }
    }

    private static void requireUniqueParams(List<Param> params, String label, List<String> problems) {
        Set<String> names = new HashSet<>();
        for (Param param : params) {
            if (!names.add(param.name())) {
                problems.add(label + " has duplicate parameter " + param.name());
            }
        }
    }
}
