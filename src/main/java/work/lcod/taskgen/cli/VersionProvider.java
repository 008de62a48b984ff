package work.lcod.taskgen.cli;

import picocli.CommandLine;
import work.lcod.taskgen.model.ApiVersions;

/**
 * Reports the tool version and the API versions of the objects it generates.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEVELOPMENT_VERSION = "development";

    @Override
    public String[] getVersion() {
        String version = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "create-task " + (version == null ? DEVELOPMENT_VERSION : version),
            "pipelines: " + ApiVersions.PIPELINE_API_VERSION,
            "structures: " + ApiVersions.STRUCTURE_API_VERSION
        };
    }
}
