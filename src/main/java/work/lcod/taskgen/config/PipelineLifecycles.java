package work.lcod.taskgen.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.taskgen.syntax.ParsedPipeline;

/**
 * The stages of one pipeline kind. {@link #all()} returns them in execution order; any stage may be absent.
 * {@code pipeline} holds a fully declarative definition which, when present, takes over from the stages.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineLifecycles(
    PipelineLifecycle setup,
    PipelineLifecycle setVersion,
    PipelineLifecycle preBuild,
    PipelineLifecycle build,
    PipelineLifecycle postBuild,
    PipelineLifecycle promote,
    ParsedPipeline pipeline
) {
    public static final String SETVERSION = "setversion";

    public record NamedLifecycle(String name, PipelineLifecycle lifecycle) {}

    public static PipelineLifecycles empty() {
        return new PipelineLifecycles(null, null, null, null, null, null, null);
    }

    public List<NamedLifecycle> all() {
        return List.of(
            new NamedLifecycle("setup", setup),
            new NamedLifecycle(SETVERSION, setVersion),
            new NamedLifecycle("prebuild", preBuild),
            new NamedLifecycle("build", build),
            new NamedLifecycle("postbuild", postBuild),
            new NamedLifecycle("promote", promote)
        );
    }

    @JsonIgnore
    public boolean isDeclarative() {
        return pipeline != null;
    }

    public PipelineLifecycles withSetup(PipelineLifecycle value) {
        return new PipelineLifecycles(value, setVersion, preBuild, build, postBuild, promote, pipeline);
    }

    public PipelineLifecycles withSetVersion(PipelineLifecycle value) {
        return new PipelineLifecycles(setup, value, preBuild, build, postBuild, promote, pipeline);
    }

    public PipelineLifecycles withBuild(PipelineLifecycle value) {
        return new PipelineLifecycles(setup, setVersion, preBuild, value, postBuild, promote, pipeline);
    }

    public PipelineLifecycles withPipeline(ParsedPipeline value) {
        return new PipelineLifecycles(setup, setVersion, preBuild, build, postBuild, promote, value);
    }

    /**
     * Stage-by-stage overlay: every stage set here replaces the base stage, unset stages come from {@code base}.
     */
    public PipelineLifecycles overlay(PipelineLifecycles base) {
        if (base == null) {
            return this;
        }
        return new PipelineLifecycles(
            setup != null ? setup : base.setup,
            setVersion != null ? setVersion : base.setVersion,
            preBuild != null ? preBuild : base.preBuild,
            build != null ? build : base.build,
            postBuild != null ? postBuild : base.postBuild,
            promote != null ? promote : base.promote,
            pipeline != null ? pipeline : base.pipeline
        );
    }
}
