package work.lcod.taskgen.cluster;

import work.lcod.taskgen.shared.TaskGenerationException;

/**
 * A cluster mutation failed, including a pipeline run that could not be created within the retry budget.
 */
public class ApplyException extends TaskGenerationException {
    public ApplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
