package work.lcod.taskgen.compile;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.taskgen.config.PipelineConfig;
import work.lcod.taskgen.config.PipelineKind;
import work.lcod.taskgen.config.PipelineLifecycle;
import work.lcod.taskgen.config.PipelineLifecycles;
import work.lcod.taskgen.config.PipelineStep;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.Volume;

/**
 * Expands the step trees of a pipeline kind into a flat list of container steps.
 */
public final class LifecycleStepCompiler {
    static final String CREDENTIALS_STEP_NAME = "git-credentials";
    private static final List<String> SHELL = List.of("/bin/sh");

    private static final Logger log = LoggerFactory.getLogger(LifecycleStepCompiler.class);

    private final PodTemplateResolver podTemplates;
    private final EnvironmentInjector injector;

    public LifecycleStepCompiler(PodTemplateResolver podTemplates, EnvironmentInjector injector) {
        this.podTemplates = podTemplates;
        this.injector = injector;
    }

    public CompiledSteps compile(
        PipelineConfig config,
        PipelineKind kind,
        StepCompilationRequest request,
        CompilationContext context
    ) {
        PipelineLifecycles lifecycles = config.lifecycles(kind);
        if (kind == PipelineKind.RELEASE && request.credentialsCommand() != null && !request.credentialsCommand().isBlank()) {
            PipelineLifecycle setup = lifecycles.setup() == null ? new PipelineLifecycle(List.of()) : lifecycles.setup();
            lifecycles = lifecycles.withSetup(
                setup.withPrependedStep(PipelineStep.command(CREDENTIALS_STEP_NAME, request.credentialsCommand()))
            );
        }

        String container = config.agent().container();
        if (container == null || container.isBlank()) {
            container = podTemplates.defaultTemplate();
            log.warn("No 'agent.container' specified in the pipeline configuration so defaulting to use: {}", container);
        }
        String workspaceDir = WorkspacePaths.workspaceDir(request.sourceName());
        if (request.injection().git() == null) {
            log.warn("No git repository information available; directory placeholders are left as they are");
        }

        var steps = new ArrayList<Container>();
        var volumes = new ArrayList<Volume>();
        for (PipelineLifecycles.NamedLifecycle stage : lifecycles.all()) {
            if (stage.lifecycle() == null) {
                continue;
            }
            if (request.noSetVersion() && PipelineLifecycles.SETVERSION.equals(stage.name())) {
                log.debug("Skipping the {} stage of the {} pipeline for {}", stage.name(), kind, request.language());
                continue;
            }
            for (PipelineStep step : stage.lifecycle().steps()) {
                compileStep(step, container, workspaceDir, stage.name(), request, context, steps, volumes);
            }
        }
        return new CompiledSteps(steps, volumes);
    }

    private void compileStep(
        PipelineStep step,
        String inheritedContainer,
        String inheritedDir,
        String stageName,
        StepCompilationRequest request,
        CompilationContext context,
        List<Container> steps,
        List<Volume> volumes
    ) {
        String containerName = notBlank(step.container()) ? step.container() : inheritedContainer;
        String dir = notBlank(step.dir()) ? step.dir() : inheritedDir;
        dir = WorkspacePaths.substitutePlaceholders(dir, request.injection().git());
        dir = WorkspacePaths.resolve(dir, WorkspacePaths.workspaceDir(request.sourceName()));

        if (step.hasCommand()) {
            PodTemplateResolver.ResolvedContainer resolved = podTemplates.resolve(containerName, context);
            int number = context.nextStepNumber();
            String stepName = notBlank(step.name()) ? step.name() : "step" + number;

            Container container = resolved.container().withName(stageName + "-" + stepName);
            var injected = injector.inject(container, resolved.volumes(), request.injection());
            container = injected.container()
                .withCommand(SHELL, List.of("-c", CommandText.normalize(step.command())))
                .withWorkingDir(dir);
            if (notBlank(request.customImage())) {
                container = container.withImage(request.customImage());
            }
            steps.add(container);
            List<Volume> combined = EnvironmentInjector.combineVolumes(volumes, injected.volumes());
            volumes.clear();
            volumes.addAll(combined);
        }
        for (PipelineStep child : step.steps()) {
            compileStep(child, containerName, dir, stageName, request, context, steps, volumes);
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
