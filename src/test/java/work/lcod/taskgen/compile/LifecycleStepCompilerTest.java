package work.lcod.taskgen.compile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.taskgen.config.ConfigException;
import work.lcod.taskgen.config.PipelineConfig;
import work.lcod.taskgen.config.PipelineKind;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.EnvVar;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.support.Fixtures;

class LifecycleStepCompilerTest {
    private final EnvironmentInjector injector = new EnvironmentInjector();
    private final LifecycleStepCompiler compiler = new LifecycleStepCompiler(
        new PodTemplateResolver(Fixtures.podTemplates()),
        injector
    );

    private StepCompilationRequest request(boolean noSetVersion, String customImage, String credentials) {
        return new StepCompilationRequest(
            "maven",
            "source",
            customImage,
            noSetVersion,
            credentials,
            Fixtures.injection(PipelineKind.RELEASE, List.of(new Param("version", "1.0.0")))
        );
    }

    @Test
    void compilesStagesInLifecycleOrder() {
        CompiledSteps compiled = compiler.compile(
            Fixtures.mavenBuildPack(),
            PipelineKind.RELEASE,
            request(false, null, null),
            new CompilationContext()
        );

        List<String> names = compiled.steps().stream().map(Container::name).collect(Collectors.toList());
        assertEquals(List.of("setversion-set-version", "build-step2", "build-step3", "promote-changelog"), names);

        Container changelog = compiled.steps().get(3);
        assertEquals(List.of("/bin/sh"), changelog.command());
        assertEquals(List.of("-c", "jx step changelog --version v${VERSION}"), changelog.args());
        assertEquals("/workspace/source", changelog.workingDir());
        assertEquals("gcr.io/acme/builder-maven:0.1", changelog.image());
    }

    @Test
    void childStepsOverrideContainerAndDirectory() {
        CompiledSteps compiled = compiler.compile(
            Fixtures.mavenBuildPack(),
            PipelineKind.RELEASE,
            request(false, null, null),
            new CompilationContext()
        );

        Container skaffold = compiled.steps().get(2);
        assertEquals("gcr.io/acme/builder-base:0.1", skaffold.image());
        assertEquals("/workspace/source/charts/demo", skaffold.workingDir());
        assertEquals("/workspace/source", compiled.steps().get(1).workingDir());
    }

    @Test
    void injectsEnvironmentIntoEveryStep() {
        CompiledSteps compiled = compiler.compile(
            Fixtures.mavenBuildPack(),
            PipelineKind.RELEASE,
            request(false, null, null),
            new CompilationContext()
        );

        Container mvn = compiled.steps().get(1);
        List<String> envNames = mvn.env().stream().map(EnvVar::name).collect(Collectors.toList());
        assertFalse(envNames.contains("JENKINS_URL"));
        assertEquals("MAVEN_OPTS", envNames.get(0));
        assertTrue(mvn.env().contains(new EnvVar("JOB_NAME", "acme/demo/master")));
        assertTrue(mvn.env().contains(new EnvVar("VERSION", "${inputs.params.version}")));

        Set<String> volumeNames = compiled.volumes().stream().map(v -> v.name()).collect(Collectors.toSet());
        assertEquals(Set.of("m2", EnvironmentInjector.POD_INFO_VOLUME), volumeNames);
        assertEquals(2, compiled.volumes().size());
    }

    @Test
    void skipsSetVersionStageWhenDisabled() {
        CompiledSteps compiled = compiler.compile(
            Fixtures.mavenBuildPack(),
            PipelineKind.RELEASE,
            request(true, null, null),
            new CompilationContext()
        );

        assertEquals("build-step1", compiled.steps().get(0).name());
        assertEquals(3, compiled.steps().size());
    }

    @Test
    void prependsCredentialsStepToReleases() {
        CompiledSteps compiled = compiler.compile(
            Fixtures.mavenBuildPack(),
            PipelineKind.RELEASE,
            request(false, null, "jx step git credentials"),
            new CompilationContext()
        );

        Container first = compiled.steps().get(0);
        assertEquals("setup-" + LifecycleStepCompiler.CREDENTIALS_STEP_NAME, first.name());
        assertEquals(List.of("-c", "jx step git credentials"), first.args());
    }

    @Test
    void customImageReplacesTemplateImages() {
        CompiledSteps compiled = compiler.compile(
            Fixtures.mavenBuildPack(),
            PipelineKind.RELEASE,
            request(false, "acme/custom:1", null),
            new CompilationContext()
        );

        assertTrue(compiled.steps().stream().allMatch(s -> "acme/custom:1".equals(s.image())));
    }

    @Test
    void compilationIsDeterministic() {
        CompiledSteps first = compiler.compile(Fixtures.mavenBuildPack(), PipelineKind.RELEASE, request(false, null, null), new CompilationContext());
        CompiledSteps second = compiler.compile(Fixtures.mavenBuildPack(), PipelineKind.RELEASE, request(false, null, null), new CompilationContext());
        assertEquals(first, second);
    }

    @Test
    void defaultStepNamesAreUniqueWithinOnePass() {
        var context = new CompilationContext();
        CompiledSteps compiled = compiler.compile(Fixtures.mavenBuildPack(), PipelineKind.RELEASE, request(false, null, null), context);

        var names = new HashSet<String>();
        for (Container step : compiled.steps()) {
            assertTrue(names.add(step.name()), "duplicate step name " + step.name());
        }
        assertEquals(compiled.steps().size(), context.stepCount());
    }

    @Test
    void missingContainerFallsBackToDefaultTemplate() {
        PipelineConfig config = new PipelineConfig(
            new PipelineConfig.Agent("gradle"),
            List.of(),
            Fixtures.mavenBuildPack().pipelines()
        );
        var context = new CompilationContext();
        CompiledSteps compiled = compiler.compile(config, PipelineKind.PULL_REQUEST, request(false, null, null), context);

        assertEquals("gcr.io/acme/builder-base:0.1", compiled.steps().get(0).image());
        assertEquals(Set.of("gradle"), context.missingPodTemplates());
    }

    @Test
    void kindWithoutLifecyclesIsAConfigError() {
        assertThrows(ConfigException.class, () -> compiler.compile(
            Fixtures.mavenBuildPack(),
            PipelineKind.FEATURE,
            request(false, null, null),
            new CompilationContext()
        ));
    }
}
