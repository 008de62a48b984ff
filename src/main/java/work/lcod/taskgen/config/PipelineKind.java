package work.lcod.taskgen.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The kinds of pipeline a project can declare lifecycles for.
 */
public enum PipelineKind {
    RELEASE("release"),
    PULL_REQUEST("pullrequest"),
    FEATURE("feature");

    private final String id;

    PipelineKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static PipelineKind from(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedKindException("No pipeline kind given. Supported values are " + supportedValues());
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PipelineKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return kind;
            }
        }
        throw new UnsupportedKindException(
            "Unknown pipeline kind " + value + ". Supported values are " + supportedValues()
        );
    }

    public static String supportedValues() {
        return Arrays.stream(values()).map(PipelineKind::id).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return id;
    }
}
