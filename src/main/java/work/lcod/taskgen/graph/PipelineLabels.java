package work.lcod.taskgen.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.taskgen.config.ConfigException;
import work.lcod.taskgen.model.GitRepository;

/**
 * Labels stamped on every generated object.
 */
public final class PipelineLabels {
    public static final String FROM_YAML = "taskgen.lcod.work/from-yaml";

    private static final Logger log = LoggerFactory.getLogger(PipelineLabels.class);

    private PipelineLabels() {}

    /**
     * {@code owner}, {@code repo} and {@code branch}, the from-yaml marker for declarative pipelines,
     * then custom {@code key=value} labels, which win over the derived ones.
     */
    public static Map<String, String> build(GitRepository git, String branch, boolean fromYaml, List<String> customLabels) {
        var labels = new LinkedHashMap<String, String>();
        if (git != null) {
            labels.put("owner", git.organisation());
            labels.put("repo", git.name());
        }
        labels.put("branch", branch == null ? "" : branch);
        if (fromYaml) {
            labels.putAll(fromYamlLabels());
        }
        for (String customLabel : customLabels == null ? List.<String>of() : customLabels) {
            String[] parts = customLabel.split("=", -1);
            if (parts.length != 2) {
                throw new ConfigException("Expected 2 parts to label " + customLabel + " but got " + parts.length);
            }
            log.debug("Adding custom label {}={}", parts[0], parts[1]);
            labels.put(parts[0], parts[1]);
        }
        return labels;
    }

    public static Map<String, String> fromYamlLabels() {
        return Map.of(FROM_YAML, "true");
    }
}
