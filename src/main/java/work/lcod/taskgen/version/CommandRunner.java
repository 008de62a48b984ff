package work.lcod.taskgen.version;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs a shell command synchronously in a directory and returns its output.
 */
@FunctionalInterface
public interface CommandRunner {
    /**
     * @throws IOException when the command cannot be started or exits with a non-zero status
     */
    String run(String command, Path dir) throws IOException;
}
