package work.lcod.taskgen.compile;

import java.util.List;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.Volume;

/**
 * Flat, ordered execution steps of one lifecycle plus the volumes they need (unique by name).
 */
public record CompiledSteps(List<Container> steps, List<Volume> volumes) {
    public CompiledSteps {
        steps = List.copyOf(steps);
        volumes = List.copyOf(volumes);
    }
}
