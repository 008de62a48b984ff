package work.lcod.taskgen.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.taskgen.model.EnvVar;

/**
 * Effective pipeline configuration: default agent container, pipeline-wide environment and per-kind lifecycles.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PipelineConfig(Agent agent, List<EnvVar> env, Pipelines pipelines) {
    public PipelineConfig {
        agent = agent == null ? new Agent(null) : agent;
        env = env == null ? List.of() : List.copyOf(env);
        pipelines = pipelines == null ? Pipelines.empty() : pipelines;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Agent(String container) {}

    /**
     * Lifecycles for {@code kind}; a kind without any entry is a configuration error.
     */
    public PipelineLifecycles lifecycles(PipelineKind kind) {
        return pipelines.get(kind).orElseThrow(() -> new ConfigException(
            "No " + kind + " pipeline is defined in the pipeline configuration"
        ));
    }

    public PipelineConfig withPipelines(Pipelines value) {
        return new PipelineConfig(agent, env, value);
    }
}
