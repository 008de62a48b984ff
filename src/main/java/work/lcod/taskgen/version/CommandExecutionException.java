package work.lcod.taskgen.version;

import work.lcod.taskgen.shared.TaskGenerationException;

/**
 * A version-resolution shell step failed.
 */
public class CommandExecutionException extends TaskGenerationException {
    private final String command;

    public CommandExecutionException(String command, String message, Throwable cause) {
        super(message, cause);
        this.command = command;
    }

    public String command() {
        return command;
    }
}
