package work.lcod.taskgen.version;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link CommandRunner} backed by {@code /bin/sh -c}. Standard error is merged into the returned output.
 */
public final class ProcessCommandRunner implements CommandRunner {
    @Override
    public String run(String command, Path dir) throws IOException {
        var builder = new ProcessBuilder(List.of("/bin/sh", "-c", command))
            .directory(dir.toFile())
            .redirectErrorStream(true);
        Process process = builder.start();
        String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while running: " + command, ex);
        }
        if (exitCode != 0) {
            throw new IOException("Command exited with status " + exitCode + ": " + command + System.lineSeparator() + output.strip());
        }
        return output;
    }
}
