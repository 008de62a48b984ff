package work.lcod.taskgen.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The project's own configuration file: an optional build pack name and an optional pipeline override.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(String buildPack, PipelineConfig pipelineConfig) {}
