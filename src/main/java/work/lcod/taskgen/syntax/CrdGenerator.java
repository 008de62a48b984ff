package work.lcod.taskgen.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.taskgen.compile.CommandText;
import work.lcod.taskgen.compile.CompilationContext;
import work.lcod.taskgen.compile.EnvironmentInjector;
import work.lcod.taskgen.compile.PodTemplateResolver;
import work.lcod.taskgen.compile.WorkspacePaths;
import work.lcod.taskgen.model.ApiVersions;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.EnvVar;
import work.lcod.taskgen.model.GitRepository;
import work.lcod.taskgen.model.ObjectMeta;
import work.lcod.taskgen.model.Pipeline;
import work.lcod.taskgen.model.PipelineStructure;
import work.lcod.taskgen.model.PipelineTask;
import work.lcod.taskgen.model.Task;
import work.lcod.taskgen.model.TaskResource;
import work.lcod.taskgen.model.Volume;
import work.lcod.taskgen.shared.KubeNames;

/**
 * Turns a declarative pipeline into one task per stage that has steps, a pipeline running those
 * tasks in declaration order, and the structure record describing the stage tree.
 *
 * <p>The execution platform has no task ordering of its own, so every task outputs the
 * {@value #TEMP_ORDERING_RESOURCE} resource and every task after the first takes it as input
 * {@code from} its predecessor.
 */
public final class CrdGenerator {
    public static final String TEMP_ORDERING_RESOURCE = "temp-ordering-resource";
    private static final List<String> SHELL = List.of("/bin/sh", "-c");

    private final PodTemplateResolver podTemplates;

    public CrdGenerator(PodTemplateResolver podTemplates) {
        this.podTemplates = podTemplates;
    }

    /**
     * @param pipeline     validated declarative pipeline
     * @param pipelineName name of the generated pipeline; also the name of its source resource
     * @param sourceName   name of the git input every task clones into {@code /workspace/<sourceName>}
     * @param git          repository whose name and owner replace the directory placeholders; may be {@code null}
     * @param labels       labels stamped on every generated object
     */
    public GeneratedCrds generate(
        ParsedPipeline pipeline,
        String pipelineName,
        String sourceName,
        GitRepository git,
        Map<String, String> labels,
        CompilationContext context
    ) {
        var tasks = new ArrayList<Task>();
        var pipelineTasks = new ArrayList<PipelineTask>();
        var structureStages = new ArrayList<PipelineStructure.Stage>();
        walk(pipeline.stages(), pipeline.agent(), pipeline.environment(), 0, null,
            new StageWalk(pipelineName, sourceName, git, labels, context, tasks, pipelineTasks, structureStages));

        var spec = new Pipeline.Spec(
            List.of(
                new Pipeline.DeclaredResource(pipelineName, ApiVersions.RESOURCE_TYPE_GIT),
                new Pipeline.DeclaredResource(TEMP_ORDERING_RESOURCE, ApiVersions.RESOURCE_TYPE_IMAGE)
            ),
            pipelineTasks
        );
        Pipeline generated = Pipeline.of(ObjectMeta.named(pipelineName, labels), spec);
        PipelineStructure structure = PipelineStructure.of(ObjectMeta.named(pipelineName, labels), pipelineName, structureStages);
        return new GeneratedCrds(generated, tasks, structure);
    }

    private void walk(
        List<ParsedPipeline.Stage> stages,
        ParsedPipeline.Agent inheritedAgent,
        List<EnvVar> inheritedEnv,
        int depth,
        String parent,
        StageWalk walk
    ) {
        for (int i = 0; i < stages.size(); i++) {
            ParsedPipeline.Stage stage = stages.get(i);
            ParsedPipeline.Agent agent = stage.agent() != null && !stage.agent().isEmpty() ? stage.agent() : inheritedAgent;
            List<EnvVar> env = overlay(stage.environment(), inheritedEnv);
            String stageName = stage.name();

            String taskName = null;
            if (!stage.steps().isEmpty()) {
                taskName = addTask(stage, agent, env, walk);
            }
            walk.structure().add(new PipelineStructure.Stage(
                stageName,
                depth,
                parent,
                taskName,
                i > 0 ? stages.get(i - 1).name() : null,
                i < stages.size() - 1 ? stages.get(i + 1).name() : null,
                stage.stages().stream().map(ParsedPipeline.Stage::name).toList()
            ));
            walk(stage.stages(), agent, env, depth + 1, stageName, walk);
        }
    }

    private String addTask(ParsedPipeline.Stage stage, ParsedPipeline.Agent agent, List<EnvVar> env, StageWalk walk) {
        String stageId = KubeNames.toValidName(stage.name());
        String taskName = walk.pipelineName() + "-" + stageId;
        String workspaceDir = WorkspacePaths.workspaceDir(walk.sourceName());

        var steps = new ArrayList<Container>();
        var volumes = new ArrayList<Volume>();
        int index = 0;
        for (ParsedPipeline.StageStep step : stage.steps()) {
            index++;
            Container base;
            if (step.image() != null && !step.image().isBlank()) {
                base = new Container(null, step.image(), List.of(), List.of(), null, List.of(), List.of());
            } else if (agent.image() != null && !agent.image().isBlank()) {
                base = new Container(null, agent.image(), List.of(), List.of(), null, List.of(), List.of());
            } else {
                PodTemplateResolver.ResolvedContainer resolved = podTemplates.resolve(agent.label(), walk.context());
                base = resolved.container();
                List<Volume> combined = EnvironmentInjector.combineVolumes(volumes, resolved.volumes());
                volumes.clear();
                volumes.addAll(combined);
            }
            String stepName = step.name() != null && !step.name().isBlank()
                ? KubeNames.toValidName(step.name())
                : "step" + index;
            Container container = base.withName(stepName)
                .withEnv(overlay(env, base.env()))
                .withWorkingDir(WorkspacePaths.resolve(WorkspacePaths.substitutePlaceholders(step.dir(), walk.git()), workspaceDir));
            if (step.args().isEmpty()) {
                container = container.withCommand(SHELL, List.of(CommandText.normalize(step.command())));
            } else {
                container = container.withCommand(List.of(step.command()), step.args());
            }
            steps.add(container);
        }

        boolean first = walk.pipelineTasks().isEmpty();
        var inputResources = new ArrayList<TaskResource>();
        inputResources.add(new TaskResource(walk.sourceName(), ApiVersions.RESOURCE_TYPE_GIT, null));
        var pipelineInputs = new ArrayList<PipelineTask.InputResource>();
        pipelineInputs.add(new PipelineTask.InputResource(walk.sourceName(), walk.pipelineName(), List.of()));
        if (!first) {
            String previous = walk.pipelineTasks().get(walk.pipelineTasks().size() - 1).name();
            inputResources.add(new TaskResource(TEMP_ORDERING_RESOURCE, ApiVersions.RESOURCE_TYPE_IMAGE, null));
            pipelineInputs.add(new PipelineTask.InputResource(TEMP_ORDERING_RESOURCE, TEMP_ORDERING_RESOURCE, List.of(previous)));
        }
        var spec = new Task.Spec(
            new Task.Inputs(inputResources, List.of()),
            new Task.Outputs(List.of(new TaskResource(TEMP_ORDERING_RESOURCE, ApiVersions.RESOURCE_TYPE_IMAGE, null))),
            steps,
            volumes
        );
        walk.tasks().add(Task.of(ObjectMeta.named(taskName, walk.labels()), spec));
        walk.pipelineTasks().add(new PipelineTask(
            stageId,
            new PipelineTask.TaskRef(taskName, ApiVersions.KIND_TASK, ApiVersions.PIPELINE_API_VERSION),
            new PipelineTask.Resources(
                pipelineInputs,
                List.of(new PipelineTask.OutputResource(TEMP_ORDERING_RESOURCE, TEMP_ORDERING_RESOURCE))
            ),
            List.of()
        ));
        return taskName;
    }

    /**
     * Entries of {@code primary} first, then those of {@code fallback} whose name is not taken.
     */
    private static List<EnvVar> overlay(List<EnvVar> primary, List<EnvVar> fallback) {
        var answer = new ArrayList<EnvVar>(primary);
        for (EnvVar env : fallback) {
            if (answer.stream().noneMatch(e -> e.name().equals(env.name()))) {
                answer.add(env);
            }
        }
        return answer;
    }

    private record StageWalk(
        String pipelineName,
        String sourceName,
        GitRepository git,
        Map<String, String> labels,
        CompilationContext context,
        List<Task> tasks,
        List<PipelineTask> pipelineTasks,
        List<PipelineStructure.Stage> structure
    ) {}

    public record GeneratedCrds(Pipeline pipeline, List<Task> tasks, PipelineStructure structure) {
        public GeneratedCrds {
            tasks = List.copyOf(tasks);
        }
    }
}
