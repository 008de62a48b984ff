package work.lcod.taskgen.cli;

import picocli.CommandLine;
import work.lcod.taskgen.shared.TaskGenerationException;

/**
 * Prints a one-line failure. Generation failures already name the operation and object, so their
 * message is printed as is; anything else is prefixed with its type. The stack trace follows when
 * {@code -Dtaskgen.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "taskgen.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        String message = ex.getMessage();
        if (ex instanceof TaskGenerationException && message != null && !message.isBlank()) {
            return message;
        }
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return ex.getClass().getSimpleName() + ": " + message;
    }
}
