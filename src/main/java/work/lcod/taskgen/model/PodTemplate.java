package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * A pre-provisioned execution shape for one logical container name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PodTemplate(List<Container> containers, List<Volume> volumes) {
    public PodTemplate {
        containers = containers == null ? List.of() : List.copyOf(containers);
        volumes = volumes == null ? List.of() : List.copyOf(volumes);
    }

    public static PodTemplate of(Container container, Volume... volumes) {
        return new PodTemplate(List.of(container), List.of(volumes));
    }
}
