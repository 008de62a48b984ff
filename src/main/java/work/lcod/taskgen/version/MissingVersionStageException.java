package work.lcod.taskgen.version;

import work.lcod.taskgen.shared.TaskGenerationException;

public class MissingVersionStageException extends TaskGenerationException {
    public MissingVersionStageException(String message) {
        super(message);
    }
}
