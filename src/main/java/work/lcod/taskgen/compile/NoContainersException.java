package work.lcod.taskgen.compile;

import work.lcod.taskgen.shared.TaskGenerationException;

public class NoContainersException extends TaskGenerationException {
    public NoContainersException(String message) {
        super(message);
    }
}
