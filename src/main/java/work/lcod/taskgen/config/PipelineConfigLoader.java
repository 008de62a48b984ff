package work.lcod.taskgen.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.lcod.taskgen.model.PodTemplate;

/**
 * Reads build pack pipelines, project configuration and pod templates from YAML files.
 */
public final class PipelineConfigLoader {
    public static final String BUILD_PACK_PIPELINE_FILE = "pipeline.yaml";
    public static final String PROJECT_CONFIG_FILE = "jenkins-x.yml";
    public static final String NO_BUILD_PACK = "none";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, PodTemplate>> POD_TEMPLATES = new TypeReference<>() {};

    private PipelineConfigLoader() {}

    public static PipelineConfig loadBuildPack(Path packsDir, String pack) {
        Path packDir = packsDir.resolve(pack);
        Path pipelineFile = packDir.resolve(BUILD_PACK_PIPELINE_FILE);
        if (!Files.isRegularFile(pipelineFile)) {
            throw new ConfigException("No build pack for " + pack + " exists at directory " + packDir);
        }
        try (var in = Files.newInputStream(pipelineFile)) {
            return YAML_MAPPER.readValue(in, PipelineConfig.class);
        } catch (IOException ex) {
            throw new ConfigException("Failed to load build pack pipeline YAML: " + pipelineFile, ex);
        }
    }

    /**
     * Loads {@code jenkins-x-<context>.yml} when a context is given and that file exists, otherwise
     * {@code jenkins-x.yml}. A project without any configuration file yields an empty configuration.
     */
    public static LoadedProjectConfig loadProjectConfig(Path projectDir, String context) {
        Path file = projectDir.resolve(PROJECT_CONFIG_FILE);
        if (context != null && !context.isBlank()) {
            Path contextFile = projectDir.resolve("jenkins-x-" + context + ".yml");
            if (Files.isRegularFile(contextFile)) {
                file = contextFile;
            }
        }
        if (!Files.isRegularFile(file)) {
            return new LoadedProjectConfig(new ProjectConfig(null, null), file);
        }
        try (var in = Files.newInputStream(file)) {
            ProjectConfig config = YAML_MAPPER.readValue(in, ProjectConfig.class);
            return new LoadedProjectConfig(config == null ? new ProjectConfig(null, null) : config, file);
        } catch (IOException ex) {
            throw new ConfigException("Failed to load project config " + file, ex);
        }
    }

    public static Map<String, PodTemplate> loadPodTemplates(Path file) {
        try (var in = Files.newInputStream(file)) {
            Map<String, PodTemplate> templates = YAML_MAPPER.readValue(in, POD_TEMPLATES);
            return templates == null ? Map.of() : new LinkedHashMap<>(templates);
        } catch (IOException ex) {
            throw new ConfigException("Failed to load pod templates from " + file, ex);
        }
    }

    public record LoadedProjectConfig(ProjectConfig config, Path file) {
        public Optional<PipelineConfig> pipelineConfig() {
            return Optional.ofNullable(config.pipelineConfig());
        }
    }
}
