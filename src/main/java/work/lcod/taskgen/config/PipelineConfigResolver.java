package work.lcod.taskgen.config;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.taskgen.model.EnvVar;

/**
 * Merges a build pack's default configuration with a project's local override.
 */
public final class PipelineConfigResolver {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfigResolver.class);

    /**
     * @param base     configuration shipped with the build pack
     * @param override the project's own configuration, if any
     * @return the effective configuration
     */
    public PipelineConfig resolve(PipelineConfig base, Optional<PipelineConfig> override) {
        if (override.isEmpty()) {
            return base;
        }
        PipelineConfig local = override.get();
        if (local.pipelines().hasDeclarativePipeline()) {
            log.debug("Local configuration declares a pipeline; build pack configuration is not consulted");
            return local;
        }
        if (base == null) {
            return local;
        }
        Pipelines merged = base.pipelines();
        for (PipelineKind kind : PipelineKind.values()) {
            Optional<PipelineLifecycles> localLifecycles = local.pipelines().get(kind);
            if (localLifecycles.isPresent()) {
                merged = merged.with(kind, localLifecycles.get().overlay(base.pipelines().get(kind).orElse(null)));
            }
        }
        return new PipelineConfig(mergeAgent(local.agent(), base.agent()), mergeEnv(local.env(), base.env()), merged);
    }

    private PipelineConfig.Agent mergeAgent(PipelineConfig.Agent local, PipelineConfig.Agent base) {
        if (local.container() != null && !local.container().isBlank()) {
            return local;
        }
        return base;
    }

    private List<EnvVar> mergeEnv(List<EnvVar> local, List<EnvVar> base) {
        var names = new LinkedHashSet<String>();
        var merged = new ArrayList<EnvVar>();
        for (EnvVar env : local) {
            if (names.add(env.name())) {
                merged.add(env);
            }
        }
        for (EnvVar env : base) {
            if (names.add(env.name())) {
                merged.add(env);
            }
        }
        return merged;
    }
}
