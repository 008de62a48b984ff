package work.lcod.taskgen.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.taskgen.compile.CompilationContext;
import work.lcod.taskgen.compile.CompiledSteps;
import work.lcod.taskgen.compile.EnvironmentInjector;
import work.lcod.taskgen.compile.InjectionContext;
import work.lcod.taskgen.compile.LifecycleStepCompiler;
import work.lcod.taskgen.compile.StepCompilationRequest;
import work.lcod.taskgen.config.ConfigException;
import work.lcod.taskgen.config.PipelineConfig;
import work.lcod.taskgen.config.PipelineLifecycles;
import work.lcod.taskgen.model.ApiVersions;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.ObjectMeta;
import work.lcod.taskgen.model.Pipeline;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.model.PipelineTask;
import work.lcod.taskgen.model.Task;
import work.lcod.taskgen.model.TaskParam;
import work.lcod.taskgen.model.TaskResource;
import work.lcod.taskgen.model.Volume;
import work.lcod.taskgen.shared.KubeNames;
import work.lcod.taskgen.syntax.CrdGenerator;
import work.lcod.taskgen.syntax.ParsedPipeline;
import work.lcod.taskgen.syntax.ParsedPipelineValidator;

/**
 * Produces the task graph for a pipeline kind, either from a declarative pipeline or from build pack
 * lifecycles. Only the skeleton differs between the two; injection and validation are shared.
 */
public final class CrdGraphBuilder {
    static final String BUILD_PACK_PIPELINE_TASK = "build";

    private static final Logger log = LoggerFactory.getLogger(CrdGraphBuilder.class);

    private final LifecycleStepCompiler compiler;
    private final CrdGenerator crdGenerator;
    private final EnvironmentInjector injector;
    private final ParsedPipelineValidator pipelineValidator = new ParsedPipelineValidator();
    private final GraphValidator graphValidator = new GraphValidator();

    public CrdGraphBuilder(LifecycleStepCompiler compiler, CrdGenerator crdGenerator, EnvironmentInjector injector) {
        this.compiler = compiler;
        this.crdGenerator = crdGenerator;
        this.injector = injector;
    }

    public CrdGraph build(PipelineConfig config, GraphRequest request, CompilationContext context) {
        if (request.git() == null) {
            throw new ConfigException("Git repository information is required to generate a pipeline");
        }
        String sourceUrl = request.git().httpsUrl();
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new ConfigException(
                "Git repository " + request.git().organisation() + "/" + request.git().name() + " has no URL to clone the source from"
            );
        }
        PipelineLifecycles lifecycles = config.lifecycles(request.kind());
        ParameterSet params = ParameterSet.of(request.params());
        InjectionContext injection = new InjectionContext(
            request.dockerRegistry(),
            request.kind().id(),
            request.context(),
            request.git(),
            request.branch(),
            config.env(),
            params.toList()
        );
        if (lifecycles.isDeclarative()) {
            return buildDeclarative(lifecycles.pipeline(), request, params, injection, context);
        }
        return buildFromBuildPack(config, request, params, injection, context);
    }

    private CrdGraph buildDeclarative(
        ParsedPipeline parsed,
        GraphRequest request,
        ParameterSet params,
        InjectionContext injection,
        CompilationContext context
    ) {
        pipelineValidator.validate(parsed);
        Map<String, String> labels = PipelineLabels.build(request.git(), request.branch(), true, request.customLabels());
        String name = pipelineName(request);
        log.debug("Generating declarative pipeline {}", name);

        CrdGenerator.GeneratedCrds generated = crdGenerator.generate(parsed, name, request.sourceName(), request.git(), labels, context);
        var pipelineTasks = new ArrayList<PipelineTask>();
        for (PipelineTask task : generated.pipeline().spec().tasks()) {
            pipelineTasks.add(task.params().isEmpty() ? task.withParams(params.toList()) : task);
        }
        Pipeline pipeline = generated.pipeline().withSpec(generated.pipeline().spec().withTasks(pipelineTasks));
        graphValidator.validatePipeline(pipeline);

        List<TaskParam> taskParams = params.toTaskParams();
        var tasks = new ArrayList<Task>();
        for (Task task : generated.tasks()) {
            graphValidator.validateTask(task);
            var steps = new ArrayList<Container>();
            List<Volume> volumes = task.spec().volumes();
            for (Container step : task.spec().steps()) {
                EnvironmentInjector.VolumeInjection injected = injector.inject(step, volumes, injection);
                steps.add(injected.container());
                volumes = injected.volumes();
            }
            Task.Inputs inputs = task.spec().inputs() == null
                ? new Task.Inputs(List.of(), taskParams)
                : task.spec().inputs().withParams(taskParams);
            tasks.add(task.withSpec(task.spec().withSteps(steps, volumes).withInputs(inputs)));
        }

        var resources = new ArrayList<PipelineResource>();
        resources.add(ResourceFactory.sourceRepository(name, request.git(), request.revision(), true));
        resources.add(ResourceFactory.tempOrdering());

        var graph = new CrdGraph(pipeline, tasks, resources, Optional.of(generated.structure()), params.toList(), labels);
        graphValidator.validateGraph(graph);
        return graph;
    }

    private CrdGraph buildFromBuildPack(
        PipelineConfig config,
        GraphRequest request,
        ParameterSet params,
        InjectionContext injection,
        CompilationContext context
    ) {
        var stepRequest = new StepCompilationRequest(
            request.language(),
            request.sourceName(),
            request.customImage(),
            request.noSetVersion(),
            request.credentialsCommand(),
            injection
        );
        CompiledSteps compiled = compiler.compile(config, request.kind(), stepRequest, context);
        Map<String, String> labels = PipelineLabels.build(request.git(), request.branch(), false, request.customLabels());
        String name = pipelineName(request);

        String targetPath = request.targetPath() == null || request.targetPath().isBlank()
            ? request.sourceName()
            : request.targetPath();
        var inputs = new Task.Inputs(
            List.of(new TaskResource(request.sourceName(), ApiVersions.RESOURCE_TYPE_GIT, targetPath)),
            params.toTaskParams()
        );
        Task task = Task.of(ObjectMeta.named(name, labels), new Task.Spec(inputs, null, compiled.steps(), compiled.volumes()));

        String resourceName = KubeNames.toValidName(
            request.git().organisation() + "-" + request.git().name() + "-" + request.branch()
        );
        PipelineResource source = ResourceFactory.sourceRepository(resourceName, request.git(), request.revision(), false);
        var pipelineTask = new PipelineTask(
            BUILD_PACK_PIPELINE_TASK,
            new PipelineTask.TaskRef(task.name(), ApiVersions.KIND_TASK, task.apiVersion()),
            new PipelineTask.Resources(
                List.of(new PipelineTask.InputResource(request.sourceName(), source.name(), List.of())),
                List.of()
            ),
            params.toList()
        );
        Pipeline pipeline = Pipeline.of(
            ObjectMeta.named(name, labels),
            new Pipeline.Spec(List.of(new Pipeline.DeclaredResource(source.name(), source.type())), List.of(pipelineTask))
        );

        var graph = new CrdGraph(pipeline, List.of(task), List.of(source), Optional.empty(), params.toList(), labels);
        graphValidator.validateGraph(graph);
        return graph;
    }

    private static String pipelineName(GraphRequest request) {
        return KubeNames.pipelineResourceName(
            request.git().organisation(),
            request.git().name(),
            request.branch(),
            request.context()
        );
    }
}
