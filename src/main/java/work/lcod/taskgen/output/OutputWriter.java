package work.lcod.taskgen.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.taskgen.model.Pipeline;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.model.PipelineRun;
import work.lcod.taskgen.model.PipelineStructure;
import work.lcod.taskgen.model.Task;
import work.lcod.taskgen.shared.TaskGenerationException;

/**
 * Serializes generated objects to one YAML document per file.
 */
public final class OutputWriter {
    public static final String PIPELINE_FILE = "pipeline.yml";
    public static final String PIPELINE_RUN_FILE = "pipeline-run.yml";
    public static final String STRUCTURE_FILE = "structure.yml";

    private static final Logger log = LoggerFactory.getLogger(OutputWriter.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
    );

    /**
     * Writes {@code pipeline.yml}, {@code pipeline-run.yml}, {@code structure.yml} when a structure is
     * present, then {@code task-<i>.yml} and {@code resource-<i>.yml} numbered from zero.
     *
     * @return the files written, in write order
     */
    public List<Path> write(
        Path folder,
        Pipeline pipeline,
        List<Task> tasks,
        PipelineRun run,
        List<PipelineResource> resources,
        Optional<PipelineStructure> structure
    ) {
        try {
            Files.createDirectories(folder);
        } catch (IOException ex) {
            throw new TaskGenerationException("Failed to create output directory " + folder, ex);
        }
        var written = new ArrayList<Path>();
        written.add(writeFile(folder.resolve(PIPELINE_FILE), pipeline, "Pipeline"));
        written.add(writeFile(folder.resolve(PIPELINE_RUN_FILE), run, "PipelineRun"));
        structure.ifPresent(s -> written.add(writeFile(folder.resolve(STRUCTURE_FILE), s, "PipelineStructure")));
        for (int i = 0; i < tasks.size(); i++) {
            written.add(writeFile(folder.resolve("task-" + i + ".yml"), tasks.get(i), "Task"));
        }
        for (int i = 0; i < resources.size(); i++) {
            written.add(writeFile(folder.resolve("resource-" + i + ".yml"), resources.get(i), "PipelineResource"));
        }
        return written;
    }

    private Path writeFile(Path file, Object value, String kind) {
        try {
            Files.writeString(file, YAML_MAPPER.writeValueAsString(value));
        } catch (IOException ex) {
            throw new TaskGenerationException("Failed to save " + kind + " file " + file, ex);
        }
        log.info("generated {} at {}", kind, file);
        return file;
    }
}
