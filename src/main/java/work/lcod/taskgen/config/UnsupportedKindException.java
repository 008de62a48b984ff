package work.lcod.taskgen.config;

import work.lcod.taskgen.shared.TaskGenerationException;

public class UnsupportedKindException extends TaskGenerationException {
    public UnsupportedKindException(String message) {
        super(message);
    }
}
