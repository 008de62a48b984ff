package work.lcod.taskgen.shared;

/**
 * Root of every failure raised while compiling or applying a task graph.
 */
public class TaskGenerationException extends RuntimeException {
    public TaskGenerationException(String message) {
        super(message);
    }

    public TaskGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
