package work.lcod.taskgen.compile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.taskgen.config.ConfigException;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.PodTemplate;
import work.lcod.taskgen.model.Volume;

/**
 * Maps a logical container name to the first container (and the volumes) of its pod template.
 */
public final class PodTemplateResolver {
    public static final String DEFAULT_TEMPLATE = "default";

    private static final Logger log = LoggerFactory.getLogger(PodTemplateResolver.class);

    private final Map<String, PodTemplate> templates;
    private final String defaultTemplate;

    public PodTemplateResolver(Map<String, PodTemplate> templates) {
        this(templates, DEFAULT_TEMPLATE);
    }

    public PodTemplateResolver(Map<String, PodTemplate> templates, String defaultTemplate) {
        this.templates = templates == null ? Map.of() : new LinkedHashMap<>(templates);
        this.defaultTemplate = defaultTemplate;
    }

    public String defaultTemplate() {
        return defaultTemplate;
    }

    /**
     * A missing template is recorded in {@code context} and replaced by the default one; only a
     * missing or empty default template is fatal.
     */
    public ResolvedContainer resolve(String name, CompilationContext context) {
        PodTemplate template = templates.get(name);
        if (template == null) {
            log.warn("Could not find a pod template for containerName {}", name);
            context.recordMissingPodTemplate(name);
            template = templates.get(defaultTemplate);
            if (template == null || template.containers().isEmpty()) {
                throw new ConfigException(
                    "No containers in the default pod template " + defaultTemplate + " used in place of " + name
                );
            }
        } else if (template.containers().isEmpty()) {
            throw new NoContainersException("No Containers for pod template " + name);
        }
        return new ResolvedContainer(template.containers().get(0), template.volumes());
    }

    public record ResolvedContainer(Container container, List<Volume> volumes) {}
}
