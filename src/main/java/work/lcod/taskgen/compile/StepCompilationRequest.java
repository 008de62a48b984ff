package work.lcod.taskgen.compile;

import java.util.Objects;

/**
 * Caller settings for one compilation of build pack lifecycles.
 *
 * @param language           build pack name, used for diagnostics
 * @param sourceName         name of the source input; the workspace is {@code /workspace/<sourceName>}
 * @param customImage        image replacing every pod template image; may be {@code null}
 * @param noSetVersion       skips the setversion stage
 * @param credentialsCommand command of the setup step prepended to release pipelines; {@code null} for none
 * @param injection          environment facts for every step
 */
public record StepCompilationRequest(
    String language,
    String sourceName,
    String customImage,
    boolean noSetVersion,
    String credentialsCommand,
    InjectionContext injection
) {
    public StepCompilationRequest {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(injection, "injection");
    }
}
