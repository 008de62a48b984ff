package work.lcod.taskgen.graph;

import java.util.List;
import java.util.Objects;
import work.lcod.taskgen.config.PipelineKind;
import work.lcod.taskgen.model.GitRepository;
import work.lcod.taskgen.model.Param;

/**
 * Per-invocation facts the graph builder needs besides the effective configuration.
 *
 * @param params version parameters followed by custom pipeline parameters
 */
public record GraphRequest(
    PipelineKind kind,
    String language,
    GitRepository git,
    String branch,
    String revision,
    String context,
    String sourceName,
    String targetPath,
    String customImage,
    String dockerRegistry,
    boolean noSetVersion,
    String credentialsCommand,
    List<String> customLabels,
    List<Param> params
) {
    public GraphRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(sourceName, "sourceName");
        customLabels = customLabels == null ? List.of() : List.copyOf(customLabels);
        params = params == null ? List.of() : List.copyOf(params);
    }
}
