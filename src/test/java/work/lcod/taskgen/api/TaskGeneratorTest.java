package work.lcod.taskgen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.taskgen.cluster.RetryPolicy;
import work.lcod.taskgen.config.ConfigException;
import work.lcod.taskgen.config.PipelineConfig;
import work.lcod.taskgen.config.PipelineConfigLoader;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.EnvVar;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.model.PipelineRun;
import work.lcod.taskgen.model.PodTemplate;
import work.lcod.taskgen.model.Task;
import work.lcod.taskgen.model.Volume;
import work.lcod.taskgen.support.Fixtures;
import work.lcod.taskgen.support.InMemoryClusterClient;
import work.lcod.taskgen.support.RecordingCommandRunner;

class TaskGeneratorTest {
    private static final Path RESOURCES = Path.of("src", "test", "resources");

    @TempDir
    Path projectDir;

    private final InMemoryClusterClient cluster = new InMemoryClusterClient();
    private final RecordingCommandRunner runner = new RecordingCommandRunner()
        .writesFile("echo 1.2.3 > VERSION", "VERSION", "1.2.3\n");
    private final ByteArrayOutputStream console = new ByteArrayOutputStream();
    private final TaskGenerator generator = new TaskGenerator(
        cluster,
        runner,
        RetryPolicy::withMaxDuration,
        new PrintStream(console, true, StandardCharsets.UTF_8)
    );

    private static PipelineConfig mavenPack() {
        return PipelineConfigLoader.loadBuildPack(RESOURCES.resolve("packs"), "maven");
    }

    private static Map<String, PodTemplate> podTemplates() {
        return PipelineConfigLoader.loadPodTemplates(RESOURCES.resolve("pod-templates.yaml"));
    }

    private ProjectInputs mavenInputs() {
        return new ProjectInputs(mavenPack(), Optional.empty(), podTemplates(), Fixtures.GIT);
    }

    private CreateTaskOptions.Builder options() {
        return CreateTaskOptions.builder().pack("maven").dir(projectDir).branch("master");
    }

    @Test
    void releaseRunsSetVersionAndAppliesTheGraph() {
        CreateTaskResults results = generator.generate(options().build(), mavenInputs());

        assertTrue(results.applied());
        assertEquals(List.of("echo 1.2.3 > VERSION"), runner.commands());
        assertEquals(List.of(new Param("version", "1.2.3")), results.pipelineParams());

        PipelineRun run = cluster.get("jx", "PipelineRun", "acme-demo-master");
        assertEquals("tekton-bot", run.spec().serviceAccount());
        assertEquals("acme-demo-master", run.metadata().ownerReferences().get(0).name());
        assertEquals(List.of(new Param("version", "1.2.3")), run.spec().params());
        assertEquals("v1.2.3", results.resources().get(0).param("revision").orElseThrow());
        assertTrue(results.missingPodTemplates().isEmpty());
    }

    @Test
    void podTemplateSecretsAndVolumesReachTheCompiledTask() {
        CreateTaskResults results = generator.generate(options().noApply(true).noSetVersion(true).build(), mavenInputs());

        Task task = results.tasks().get(0);
        Container build = task.spec().steps().stream()
            .filter(step -> step.name().startsWith("build-"))
            .findFirst()
            .orElseThrow();
        assertTrue(build.env().contains(EnvVar.fromSecret("GIT_TOKEN", "git-auth", "token")));
        Volume workspace = task.spec().volumes().stream()
            .filter(volume -> "workspace-volume".equals(volume.name()))
            .findFirst()
            .orElseThrow();
        assertEquals(new Volume.EmptyDirSource(null, null), workspace.emptyDir());
        assertTrue(task.spec().volumes().stream().anyMatch(volume -> volume.persistentVolumeClaim() != null));
    }

    @Test
    void noApplyLeavesTheClusterUntouched() {
        CreateTaskResults results = generator.generate(options().noApply(true).build(), mavenInputs());

        assertFalse(results.applied());
        assertTrue(cluster.calls().isEmpty());
        assertEquals("acme-demo-master", results.pipelineRun().name());
        assertEquals("jx", results.pipeline().metadata().namespace());
    }

    @Test
    void pullRequestGetsAPreviewVersion() {
        CreateTaskOptions options = options()
            .branch(null)
            .prNumber("42")
            .pipelineKind("pullrequest")
            .buildNumber("7")
            .noApply(true)
            .build();

        CreateTaskResults results = generator.generate(options, mavenInputs());

        assertTrue(runner.commands().isEmpty());
        assertEquals(List.of(new Param("preview_version", "0.0.0-SNAPSHOT-PR-42-7")), results.pipelineParams());
        assertEquals("acme-demo-pr-42", results.pipeline().name());
    }

    @Test
    void viewStepsPrintsTheTableWithoutApplying() {
        CreateTaskResults results = generator.generate(
            options().viewSteps(true).outputDir(Optional.of(projectDir.resolve("out"))).build(),
            mavenInputs()
        );

        assertFalse(results.applied());
        assertTrue(cluster.calls().isEmpty());
        assertTrue(runner.commands().isEmpty());
        String table = console.toString(StandardCharsets.UTF_8);
        assertTrue(table.startsWith("NAME"));
        assertTrue(table.contains("mvn clean deploy"));
        assertTrue(Files.notExists(projectDir.resolve("out")));
    }

    @Test
    void writesOutputFilesWhenRequested() {
        Path out = projectDir.resolve("out");

        generator.generate(options().noApply(true).outputDir(Optional.of(out)).build(), mavenInputs());

        assertTrue(Files.isRegularFile(out.resolve("pipeline.yml")));
        assertTrue(Files.isRegularFile(out.resolve("pipeline-run.yml")));
        assertTrue(Files.isRegularFile(out.resolve("task-0.yml")));
        assertTrue(Files.isRegularFile(out.resolve("resource-0.yml")));
        assertTrue(Files.notExists(out.resolve("structure.yml")));
    }

    @Test
    void customParamsFollowTheVersionParameter() {
        CreateTaskOptions options = options().noApply(true).customParam("release_channel", "stable").build();

        CreateTaskResults results = generator.generate(options, mavenInputs());

        assertEquals(
            List.of(new Param("version", "1.2.3"), new Param("release_channel", "stable")),
            results.pipelineParams()
        );
    }

    @Test
    void unknownAgentIsReportedAsMissingTemplate() {
        var inputs = new ProjectInputs(mavenPack(), Optional.empty(), Map.of("default", podTemplates().get("default")), Fixtures.GIT);

        CreateTaskResults results = generator.generate(options().noApply(true).noSetVersion(true).build(), inputs);

        assertTrue(results.missingPodTemplates().contains("maven"));
    }

    @Test
    void missingConfigurationIsAConfigError() {
        var inputs = new ProjectInputs(null, Optional.empty(), podTemplates(), Fixtures.GIT);

        assertThrows(ConfigException.class, () -> generator.generate(options().build(), inputs));
    }

    @Test
    void objectReferencesListTasksThenPipelineThenRun() {
        CreateTaskResults results = generator.generate(options().build(), mavenInputs());

        List<String> kinds = results.objectReferences().stream().map(CreateTaskResults.ObjectReference::kind).toList();
        assertEquals(List.of("Task", "Pipeline", "PipelineRun"), kinds);
        assertTrue(results.objectReferences().stream().allMatch(ref -> "jx".equals(ref.namespace())));
    }
}
