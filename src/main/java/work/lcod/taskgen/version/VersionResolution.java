package work.lcod.taskgen.version;

import java.util.List;
import java.util.Optional;
import work.lcod.taskgen.model.Param;

/**
 * Parameters produced by version resolution and the git revision a release should build, if it changed.
 */
public record VersionResolution(List<Param> params, Optional<String> revision) {
    public VersionResolution {
        params = List.copyOf(params);
    }

    public static VersionResolution none() {
        return new VersionResolution(List.of(), Optional.empty());
    }
}
