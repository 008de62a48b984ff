package work.lcod.taskgen.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Optional;
import java.util.stream.Stream;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Pipelines(
    PipelineLifecycles release,
    @JsonAlias("pullrequest") PipelineLifecycles pullRequest,
    PipelineLifecycles feature
) {
    public static Pipelines empty() {
        return new Pipelines(null, null, null);
    }

    public Optional<PipelineLifecycles> get(PipelineKind kind) {
        return Optional.ofNullable(switch (kind) {
            case RELEASE -> release;
            case PULL_REQUEST -> pullRequest;
            case FEATURE -> feature;
        });
    }

    public Pipelines with(PipelineKind kind, PipelineLifecycles lifecycles) {
        return switch (kind) {
            case RELEASE -> new Pipelines(lifecycles, pullRequest, feature);
            case PULL_REQUEST -> new Pipelines(release, lifecycles, feature);
            case FEATURE -> new Pipelines(release, pullRequest, lifecycles);
        };
    }

    @JsonIgnore
    public boolean hasDeclarativePipeline() {
        return Stream.of(release, pullRequest, feature)
            .anyMatch(l -> l != null && l.isDeclarative());
    }
}
