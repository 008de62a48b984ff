package work.lcod.taskgen.cluster;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.taskgen.model.ApiVersions;
import work.lcod.taskgen.model.ObjectMeta;
import work.lcod.taskgen.model.Pipeline;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.model.PipelineRun;
import work.lcod.taskgen.model.PipelineStructure;
import work.lcod.taskgen.model.Task;

/**
 * Cluster store backed by a directory tree: {@code <root>/<namespace>/<kind>/<name>.yml}.
 *
 * <p>Updating an object keeps the uid it was first stored with. Creating a pipeline run whose name is
 * already taken replaces the stored run.
 */
public final class FileSystemClusterClient implements ClusterClient {
    private static final Logger log = LoggerFactory.getLogger(FileSystemClusterClient.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
    ).configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path root;

    public FileSystemClusterClient(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    @Override
    public PipelineResource createOrUpdateResource(String namespace, PipelineResource resource) {
        return store(namespace, ApiVersions.KIND_PIPELINE_RESOURCE, resource.metadata(), PipelineResource.class, resource::withMetadata);
    }

    @Override
    public Task createOrUpdateTask(String namespace, Task task) {
        return store(namespace, ApiVersions.KIND_TASK, task.metadata(), Task.class, task::withMetadata);
    }

    @Override
    public Pipeline createOrUpdatePipeline(String namespace, Pipeline pipeline) {
        return store(namespace, ApiVersions.KIND_PIPELINE, pipeline.metadata(), Pipeline.class, pipeline::withMetadata);
    }

    @Override
    public PipelineRun createPipelineRun(String namespace, PipelineRun run) {
        return store(namespace, ApiVersions.KIND_PIPELINE_RUN, run.metadata(), PipelineRun.class, run::withMetadata);
    }

    @Override
    public PipelineStructure createPipelineStructure(String namespace, PipelineStructure structure) {
        return store(namespace, ApiVersions.KIND_PIPELINE_STRUCTURE, structure.metadata(), PipelineStructure.class, structure::withMetadata);
    }

    /**
     * Reads a stored object back, empty when nothing of that kind and name exists.
     */
    public <T> Optional<T> read(String namespace, String kind, String name, Class<T> type) {
        Path file = pathFor(namespace, kind, name);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(YAML_MAPPER.readValue(file.toFile(), type));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + file, ex);
        }
    }

    private <T> T store(String namespace, String kind, ObjectMeta metadata, Class<T> type, Function<ObjectMeta, T> withMetadata) {
        if (metadata == null || metadata.name() == null || metadata.name().isBlank()) {
            throw new IllegalArgumentException("Cannot store a " + kind + " without a name");
        }
        Path file = pathFor(namespace, kind, metadata.name());
        String uid = existingUid(file).orElseGet(() -> UUID.randomUUID().toString());
        T stored = withMetadata.apply(metadata.withNamespace(namespace).withUid(uid));
        try {
            Files.createDirectories(file.getParent());
            YAML_MAPPER.writeValue(file.toFile(), stored);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + file, ex);
        }
        log.debug("stored {} {} at {}", kind, metadata.name(), file);
        return stored;
    }

    private Optional<String> existingUid(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            var node = YAML_MAPPER.readTree(file.toFile());
            var uid = node.path("metadata").path("uid");
            return uid.isTextual() && !uid.asText().isBlank() ? Optional.of(uid.asText()) : Optional.empty();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + file, ex);
        }
    }

    private Path pathFor(String namespace, String kind, String name) {
        return root.resolve(namespace).resolve(kind.toLowerCase(Locale.ROOT)).resolve(name + ".yml");
    }
}
