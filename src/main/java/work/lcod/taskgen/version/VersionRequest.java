package work.lcod.taskgen.version;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Inputs of version resolution.
 *
 * @param projectDir   directory the setversion commands run in and the {@code VERSION} file is read from
 * @param branch       branch being built
 * @param revision     revision requested by the caller, used when no branch is known
 * @param buildNumber  build number for preview versions
 * @param noSetVersion disables version resolution
 * @param viewSteps    dry-run step listing, which never resolves versions
 */
public record VersionRequest(
    Path projectDir,
    String branch,
    String revision,
    String buildNumber,
    boolean noSetVersion,
    boolean viewSteps
) {
    public VersionRequest {
        Objects.requireNonNull(projectDir, "projectDir");
    }
}
