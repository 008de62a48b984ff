package work.lcod.taskgen.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineLifecycle(List<PipelineStep> steps) {
    public PipelineLifecycle {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static PipelineLifecycle of(PipelineStep... steps) {
        return new PipelineLifecycle(List.of(steps));
    }

    public PipelineLifecycle withPrependedStep(PipelineStep step) {
        var combined = new ArrayList<PipelineStep>(steps.size() + 1);
        combined.add(step);
        combined.addAll(steps);
        return new PipelineLifecycle(combined);
    }
}
