package work.lcod.taskgen.api;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.taskgen.cluster.ApplyRequest;
import work.lcod.taskgen.cluster.ApplyResults;
import work.lcod.taskgen.cluster.ClusterClient;
import work.lcod.taskgen.cluster.PipelineReconciler;
import work.lcod.taskgen.cluster.RetryPolicy;
import work.lcod.taskgen.compile.CompilationContext;
import work.lcod.taskgen.compile.EnvironmentInjector;
import work.lcod.taskgen.compile.LifecycleStepCompiler;
import work.lcod.taskgen.compile.PodTemplateResolver;
import work.lcod.taskgen.config.ConfigException;
import work.lcod.taskgen.config.PipelineConfig;
import work.lcod.taskgen.config.PipelineConfigResolver;
import work.lcod.taskgen.config.PipelineKind;
import work.lcod.taskgen.graph.CrdGraph;
import work.lcod.taskgen.graph.CrdGraphBuilder;
import work.lcod.taskgen.graph.GraphRequest;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.output.OutputWriter;
import work.lcod.taskgen.output.StepTableView;
import work.lcod.taskgen.syntax.CrdGenerator;
import work.lcod.taskgen.version.CommandRunner;
import work.lcod.taskgen.version.VersionRequest;
import work.lcod.taskgen.version.VersionResolution;
import work.lcod.taskgen.version.VersionResolver;

/**
 * Entry point that turns project inputs into an applied task graph: resolve the configuration,
 * resolve the version, build the graph, then view, apply and render it.
 */
public final class TaskGenerator {
    private static final Logger log = LoggerFactory.getLogger(TaskGenerator.class);

    private final ClusterClient client;
    private final VersionResolver versionResolver;
    private final Function<Duration, RetryPolicy> retryPolicies;
    private final PrintStream out;
    private final PipelineConfigResolver configResolver = new PipelineConfigResolver();
    private final EnvironmentInjector injector = new EnvironmentInjector();
    private final OutputWriter outputWriter = new OutputWriter();
    private final StepTableView stepTableView = new StepTableView();

    public TaskGenerator(ClusterClient client, CommandRunner commandRunner) {
        this(client, commandRunner, RetryPolicy::withMaxDuration, System.out);
    }

    /**
     * @param retryPolicies builds the pipeline run retry policy from the requested retry duration
     * @param out           receives the step table of a {@code viewSteps} run
     */
    public TaskGenerator(
        ClusterClient client,
        CommandRunner commandRunner,
        Function<Duration, RetryPolicy> retryPolicies,
        PrintStream out
    ) {
        this.client = client;
        this.versionResolver = new VersionResolver(commandRunner);
        this.retryPolicies = retryPolicies;
        this.out = out;
    }

    public CreateTaskResults generate(CreateTaskOptions options, ProjectInputs inputs) {
        PipelineKind kind = PipelineKind.from(options.pipelineKind());
        PipelineConfig config = effectiveConfig(options, inputs);
        String branch = options.effectiveBranch();

        VersionResolution version = versionResolver.resolve(config, kind, new VersionRequest(
            options.dir(),
            branch,
            options.revision(),
            options.buildNumber(),
            options.noSetVersion(),
            options.viewSteps()
        ));
        String revision = version.revision().orElse(options.revision());

        var params = new ArrayList<Param>(version.params());
        for (Map.Entry<String, String> entry : options.customParams().entrySet()) {
            params.add(new Param(entry.getKey(), entry.getValue()));
        }

        var podTemplates = new PodTemplateResolver(inputs.podTemplates());
        var graphBuilder = new CrdGraphBuilder(
            new LifecycleStepCompiler(podTemplates, injector),
            new CrdGenerator(podTemplates),
            injector
        );
        var context = new CompilationContext();
        CrdGraph graph = graphBuilder.build(config, new GraphRequest(
            kind,
            options.pack(),
            inputs.git(),
            branch,
            revision,
            options.context(),
            options.sourceName(),
            options.targetPath(),
            options.customImage(),
            options.dockerRegistry(),
            options.noSetVersion(),
            options.credentialsCommand(),
            options.customLabels(),
            params
        ), context);
        if (!context.missingPodTemplates().isEmpty()) {
            log.warn("Missing pod templates {}; the default template was used instead", context.missingPodTemplates());
        }

        if (options.viewSteps()) {
            out.print(stepTableView.render(graph.tasks()));
            ApplyResults preview = reconcile(graph, options, true);
            return toResults(preview, graph, context, false);
        }

        boolean noApply = options.noApply();
        ApplyResults applied = reconcile(graph, options, noApply);
        options.outputDir().ifPresent(dir -> outputWriter.write(
            dir,
            applied.pipeline(),
            applied.tasks(),
            applied.pipelineRun(),
            applied.resources(),
            applied.structure()
        ));
        return toResults(applied, graph, context, !noApply);
    }

    private PipelineConfig effectiveConfig(CreateTaskOptions options, ProjectInputs inputs) {
        PipelineConfig base = inputs.buildPackConfig();
        if (base == null && inputs.projectConfig().isEmpty()) {
            throw new ConfigException(
                "No pipeline configuration found for build pack " + options.pack() + " in directory " + options.dir()
            );
        }
        return configResolver.resolve(base, inputs.projectConfig());
    }

    private ApplyResults reconcile(CrdGraph graph, CreateTaskOptions options, boolean noApply) {
        var reconciler = new PipelineReconciler(client, retryPolicies.apply(options.retryDuration()));
        return reconciler.apply(graph, new ApplyRequest(
            options.namespace(),
            options.serviceAccount(),
            options.trigger(),
            noApply
        ));
    }

    private static CreateTaskResults toResults(ApplyResults applied, CrdGraph graph, CompilationContext context, boolean wasApplied) {
        return new CreateTaskResults(
            applied.pipeline(),
            applied.tasks(),
            applied.resources(),
            applied.pipelineRun(),
            applied.structure(),
            graph.params(),
            context.missingPodTemplates(),
            wasApplied
        );
    }
}
