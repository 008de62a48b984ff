package work.lcod.taskgen.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.taskgen.compile.CompilationContext;
import work.lcod.taskgen.compile.EnvironmentInjector;
import work.lcod.taskgen.compile.LifecycleStepCompiler;
import work.lcod.taskgen.compile.PodTemplateResolver;
import work.lcod.taskgen.config.ConfigException;
import work.lcod.taskgen.config.PipelineConfig;
import work.lcod.taskgen.config.PipelineKind;
import work.lcod.taskgen.config.PipelineLifecycles;
import work.lcod.taskgen.config.Pipelines;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.EnvVar;
import work.lcod.taskgen.model.GitRepository;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.model.PipelineTask;
import work.lcod.taskgen.model.Task;
import work.lcod.taskgen.model.TaskResource;
import work.lcod.taskgen.shared.ValidationException;
import work.lcod.taskgen.support.Fixtures;
import work.lcod.taskgen.syntax.CrdGenerator;
import work.lcod.taskgen.syntax.ParsedPipeline;

class CrdGraphBuilderTest {
    private final PodTemplateResolver podTemplates = new PodTemplateResolver(Fixtures.podTemplates());
    private final EnvironmentInjector injector = new EnvironmentInjector();
    private final CrdGraphBuilder builder = new CrdGraphBuilder(
        new LifecycleStepCompiler(podTemplates, injector),
        new CrdGenerator(podTemplates),
        injector
    );

    private static GraphRequest request(PipelineKind kind, List<Param> params, List<String> labels) {
        return new GraphRequest(
            kind,
            "maven",
            Fixtures.GIT,
            "master",
            "v1.0.0",
            null,
            "source",
            null,
            null,
            "registry.acme.io",
            false,
            null,
            labels,
            params
        );
    }

    private static PipelineConfig declarative(PipelineKind kind) {
        var parsed = new ParsedPipeline(new ParsedPipeline.Agent("golang:1.12", null), List.of(), List.of(
            ParsedPipeline.Stage.withSteps("build", ParsedPipeline.StageStep.sh("make build")),
            ParsedPipeline.Stage.withSteps("test", ParsedPipeline.StageStep.sh("make test"))
        ));
        return new PipelineConfig(null, null, Pipelines.empty().with(kind, PipelineLifecycles.empty().withPipeline(parsed)));
    }

    @Test
    void buildPackPathWrapsCompiledStepsInOneTask() {
        CrdGraph graph = builder.build(
            Fixtures.mavenBuildPack(),
            request(PipelineKind.RELEASE, List.of(new Param("version", "1.0.0")), List.of()),
            new CompilationContext()
        );

        assertEquals("acme-demo-master", graph.pipeline().name());
        assertEquals(1, graph.tasks().size());
        Task task = graph.tasks().get(0);
        assertEquals("acme-demo-master", task.name());
        assertEquals(List.of(new TaskResource("source", "git", "source")), task.spec().inputs().resources());
        assertEquals("version", task.spec().inputs().params().get(0).name());
        assertTrue(graph.structure().isEmpty());

        PipelineResource source = graph.resources().get(0);
        assertEquals("acme-demo-master", source.name());
        assertEquals("v1.0.0", source.param("revision").orElseThrow());
        assertEquals("https://github.com/acme/demo.git", source.param("url").orElseThrow());

        PipelineTask pipelineTask = graph.pipeline().spec().tasks().get(0);
        assertEquals("build", pipelineTask.name());
        assertEquals(task.name(), pipelineTask.taskRef().name());
        assertEquals(List.of(new Param("version", "1.0.0")), pipelineTask.params());
        assertEquals(List.of(new Param("version", "1.0.0")), graph.params());
    }

    @Test
    void declarativePathInjectsEveryStepAndAddsOrderingResource() {
        var params = List.of(new Param("preview_version", "0.0.0-SNAPSHOT-master-1"));
        CrdGraph graph = builder.build(
            declarative(PipelineKind.PULL_REQUEST),
            request(PipelineKind.PULL_REQUEST, params, List.of()),
            new CompilationContext()
        );

        assertEquals(2, graph.tasks().size());
        for (Task task : graph.tasks()) {
            Container step = task.spec().steps().get(0);
            assertTrue(step.env().contains(new EnvVar("PREVIEW_VERSION", "${inputs.params.preview_version}")));
            assertTrue(step.env().contains(new EnvVar("PIPELINE_KIND", "pullrequest")));
            assertEquals(EnvironmentInjector.POD_INFO_VOLUME, task.spec().volumes().get(0).name());
            assertEquals("preview_version", task.spec().inputs().params().get(0).name());
        }
        assertTrue(graph.pipeline().spec().tasks().stream().allMatch(t -> t.params().equals(params)));

        Set<String> resources = graph.resources().stream().map(PipelineResource::name).collect(Collectors.toSet());
        assertEquals(Set.of("acme-demo-master", CrdGenerator.TEMP_ORDERING_RESOURCE), resources);
        assertTrue(graph.structure().isPresent());
        assertEquals("true", graph.labels().get(PipelineLabels.FROM_YAML));
    }

    @Test
    void everyReferenceResolvesWithinTheGraph() {
        CrdGraph graph = builder.build(
            declarative(PipelineKind.RELEASE),
            request(PipelineKind.RELEASE, List.of(), List.of("team=core")),
            new CompilationContext()
        );

        Set<String> taskNames = graph.tasks().stream().map(Task::name).collect(Collectors.toSet());
        Set<String> resourceNames = graph.resources().stream().map(PipelineResource::name).collect(Collectors.toSet());
        for (PipelineTask task : graph.pipeline().spec().tasks()) {
            assertTrue(taskNames.contains(task.taskRef().name()));
            for (PipelineTask.InputResource input : task.resources().inputs()) {
                assertTrue(resourceNames.contains(input.resource()));
            }
        }
        assertEquals("core", graph.pipeline().metadata().labels().get("team"));
    }

    @Test
    void missingGitRepositoryIsAConfigError() {
        var request = new GraphRequest(PipelineKind.RELEASE, "maven", null, "master", null, null, "source",
            null, null, null, false, null, List.of(), List.of());
        assertThrows(ConfigException.class, () -> builder.build(Fixtures.mavenBuildPack(), request, new CompilationContext()));
    }

    @Test
    void repositoryWithoutCloneUrlIsAConfigError() {
        var noUrl = new GitRepository(null, "acme", "demo", null);
        var request = new GraphRequest(PipelineKind.RELEASE, "maven", noUrl, "master", null, null, "source",
            null, null, null, false, null, List.of(), List.of());

        var ex = assertThrows(ConfigException.class,
            () -> builder.build(Fixtures.mavenBuildPack(), request, new CompilationContext()));
        assertTrue(ex.getMessage().contains("acme/demo"));
    }

    @Test
    void buildPackTaskSourceInputIsBoundByThePipeline() {
        CrdGraph graph = builder.build(
            Fixtures.mavenBuildPack(),
            request(PipelineKind.RELEASE, List.of(), List.of()),
            new CompilationContext()
        );

        TaskResource declared = graph.tasks().get(0).spec().inputs().resources().get(0);
        PipelineTask.InputResource bound = graph.pipeline().spec().tasks().get(0).resources().inputs().get(0);
        assertEquals(declared.name(), bound.name());
        assertEquals(graph.resources().get(0).name(), bound.resource());
    }

    @Test
    void duplicateParametersAreRejected() {
        var params = List.of(new Param("version", "1.0.0"), new Param("version", "2.0.0"));
        assertThrows(ValidationException.class, () -> builder.build(
            Fixtures.mavenBuildPack(),
            request(PipelineKind.RELEASE, params, List.of()),
            new CompilationContext()
        ));
    }

    @Test
    void invalidDeclarativePipelineIsRejected() {
        var parsed = new ParsedPipeline(null, List.of(), List.of(
            ParsedPipeline.Stage.withSteps("build", ParsedPipeline.StageStep.sh("make"))
        ));
        var config = new PipelineConfig(null, null,
            Pipelines.empty().with(PipelineKind.RELEASE, PipelineLifecycles.empty().withPipeline(parsed)));

        assertThrows(ValidationException.class, () -> builder.build(
            config,
            request(PipelineKind.RELEASE, List.of(), List.of()),
            new CompilationContext()
        ));
    }
}
