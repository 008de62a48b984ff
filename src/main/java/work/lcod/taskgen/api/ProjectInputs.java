package work.lcod.taskgen.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.lcod.taskgen.config.PipelineConfig;
import work.lcod.taskgen.model.GitRepository;
import work.lcod.taskgen.model.PodTemplate;

/**
 * Already-loaded collaborators of a generation run.
 *
 * @param buildPackConfig pipeline configuration of the build pack, {@code null} when no pack is used
 * @param projectConfig   the project's own pipeline configuration, if it has one
 * @param podTemplates    pod templates keyed by logical container name
 * @param git             identity of the repository being built
 */
public record ProjectInputs(
    PipelineConfig buildPackConfig,
    Optional<PipelineConfig> projectConfig,
    Map<String, PodTemplate> podTemplates,
    GitRepository git
) {
    public ProjectInputs {
        projectConfig = projectConfig == null ? Optional.empty() : projectConfig;
        podTemplates = podTemplates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(podTemplates));
    }
}
