package work.lcod.taskgen.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.taskgen.cluster.ApplyRequest;
import work.lcod.taskgen.cluster.ApplyResults;
import work.lcod.taskgen.cluster.PipelineReconciler;
import work.lcod.taskgen.cluster.RetryPolicy;
import work.lcod.taskgen.support.Fixtures;
import work.lcod.taskgen.support.InMemoryClusterClient;

class OutputWriterTest {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    @TempDir
    Path dir;

    private static ApplyResults results() {
        var reconciler = new PipelineReconciler(new InMemoryClusterClient(), RetryPolicy.withMaxDuration(RetryPolicy.DEFAULT_MAX_DURATION));
        return reconciler.apply(Fixtures.declarativeGraph(), new ApplyRequest("jx", "tekton-bot", "manual", true));
    }

    @Test
    void writesOneFilePerObject() throws IOException {
        ApplyResults results = results();
        Path out = dir.resolve("out");

        List<Path> written = new OutputWriter().write(
            out,
            results.pipeline(),
            results.tasks(),
            results.pipelineRun(),
            results.resources(),
            results.structure()
        );

        List<String> names = written.stream().map(p -> p.getFileName().toString()).toList();
        assertEquals(List.of(
            "pipeline.yml",
            "pipeline-run.yml",
            "structure.yml",
            "task-0.yml",
            "task-1.yml",
            "resource-0.yml",
            "resource-1.yml"
        ), names);

        JsonNode pipeline = YAML.readTree(out.resolve("pipeline.yml").toFile());
        assertEquals("Pipeline", pipeline.path("kind").asText());
        assertEquals("acme-demo-master", pipeline.path("metadata").path("name").asText());
        JsonNode run = YAML.readTree(out.resolve("pipeline-run.yml").toFile());
        assertEquals("tekton-bot", run.path("spec").path("serviceAccount").asText());
        JsonNode task = YAML.readTree(out.resolve("task-1.yml").toFile());
        assertEquals("acme-demo-master-test", task.path("metadata").path("name").asText());
        assertEquals("", task.path("spec").path("inputs").path("params").get(0).path("default").asText("missing"));
    }

    @Test
    void skipsStructureWhenAbsent() {
        ApplyResults results = results();

        new OutputWriter().write(dir, results.pipeline(), results.tasks(), results.pipelineRun(), List.of(), Optional.empty());

        assertTrue(Files.exists(dir.resolve("pipeline.yml")));
        assertTrue(Files.notExists(dir.resolve("structure.yml")));
        assertTrue(Files.notExists(dir.resolve("resource-0.yml")));
    }
}
