package work.lcod.taskgen.support;

import java.util.List;
import java.util.Map;
import work.lcod.taskgen.compile.CompilationContext;
import work.lcod.taskgen.compile.EnvironmentInjector;
import work.lcod.taskgen.compile.InjectionContext;
import work.lcod.taskgen.compile.LifecycleStepCompiler;
import work.lcod.taskgen.compile.PodTemplateResolver;
import work.lcod.taskgen.config.PipelineConfig;
import work.lcod.taskgen.config.PipelineKind;
import work.lcod.taskgen.config.PipelineLifecycle;
import work.lcod.taskgen.config.PipelineLifecycles;
import work.lcod.taskgen.config.PipelineStep;
import work.lcod.taskgen.config.Pipelines;
import work.lcod.taskgen.graph.CrdGraph;
import work.lcod.taskgen.graph.CrdGraphBuilder;
import work.lcod.taskgen.graph.GraphRequest;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.EnvVar;
import work.lcod.taskgen.model.GitRepository;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.model.PodTemplate;
import work.lcod.taskgen.model.Volume;
import work.lcod.taskgen.syntax.CrdGenerator;
import work.lcod.taskgen.syntax.ParsedPipeline;

/**
 * Small builders shared by the compiler, graph and generator tests.
 */
public final class Fixtures {
    public static final GitRepository GIT = new GitRepository("github.com", "acme", "demo", "https://github.com/acme/demo.git");

    private Fixtures() {}

    public static Map<String, PodTemplate> podTemplates() {
        var maven = new Container(
            "maven",
            "gcr.io/acme/builder-maven:0.1",
            List.of("/bin/sh"),
            List.of(),
            null,
            List.of(new EnvVar("JENKINS_URL", "http://jenkins"), new EnvVar("MAVEN_OPTS", "-Xmx1g")),
            List.of()
        );
        var base = new Container("base", "gcr.io/acme/builder-base:0.1", List.of(), List.of(), null, List.of(), List.of());
        return Map.of(
            "maven", PodTemplate.of(maven, Volume.secret("m2", "m2-settings")),
            "default", PodTemplate.of(base)
        );
    }

    public static InjectionContext injection(PipelineKind kind, List<Param> params) {
        return new InjectionContext("registry.acme.io", kind.id(), null, GIT, "master", List.of(), params);
    }

    /**
     * A maven build pack: setversion writes a version, build runs two nested steps, promote one.
     */
    public static PipelineConfig mavenBuildPack() {
        var setVersion = PipelineLifecycle.of(PipelineStep.command("set-version", "echo 1.0.0 > VERSION"));
        var build = PipelineLifecycle.of(PipelineStep.group(null, List.of(
            PipelineStep.command(null, "mvn clean deploy"),
            new PipelineStep(null, "skaffold build -f skaffold.yaml", "./charts/REPLACE_ME_APP_NAME", "default", null, List.of())
        )));
        var promote = PipelineLifecycle.of(PipelineStep.command("changelog", "jx step changelog --version v$(cat VERSION)"));
        var release = new PipelineLifecycles(null, setVersion, null, build, null, promote, null);
        var pullRequest = new PipelineLifecycles(null, null, null, PipelineLifecycle.of(PipelineStep.command(null, "mvn install")), null, null, null);
        return new PipelineConfig(new PipelineConfig.Agent("maven"), List.of(), new Pipelines(release, pullRequest, null));
    }

    public static ParsedPipeline twoStagePipeline() {
        return new ParsedPipeline(new ParsedPipeline.Agent("golang:1.12", null), List.of(), List.of(
            ParsedPipeline.Stage.withSteps("build", ParsedPipeline.StageStep.sh("make build")),
            ParsedPipeline.Stage.withSteps("test", ParsedPipeline.StageStep.sh("make test"))
        ));
    }

    /**
     * Graph of {@link #twoStagePipeline()} for a release with a {@code version} parameter.
     */
    public static CrdGraph declarativeGraph() {
        var podTemplates = new PodTemplateResolver(podTemplates());
        var injector = new EnvironmentInjector();
        var builder = new CrdGraphBuilder(new LifecycleStepCompiler(podTemplates, injector), new CrdGenerator(podTemplates), injector);
        var config = new PipelineConfig(null, null, Pipelines.empty().with(
            PipelineKind.RELEASE,
            PipelineLifecycles.empty().withPipeline(twoStagePipeline())
        ));
        var request = new GraphRequest(PipelineKind.RELEASE, null, GIT, "master", "v1.0.0", null, "source",
            null, null, "registry.acme.io", false, null, List.of(), List.of(new Param("version", "1.0.0")));
        return builder.build(config, request, new CompilationContext());
    }
}
