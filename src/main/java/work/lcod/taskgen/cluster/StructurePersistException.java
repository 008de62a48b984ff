package work.lcod.taskgen.cluster;

import work.lcod.taskgen.shared.TaskGenerationException;

/**
 * The pipeline run exists but the structure record that makes it traceable could not be stored.
 * The run is left in place.
 */
public class StructurePersistException extends TaskGenerationException {
    private final String pipelineRunName;

    public StructurePersistException(String pipelineRunName, String message, Throwable cause) {
        super(message, cause);
        this.pipelineRunName = pipelineRunName;
    }

    public String pipelineRunName() {
        return pipelineRunName;
    }
}
