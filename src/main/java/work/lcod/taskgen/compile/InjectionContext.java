package work.lcod.taskgen.compile;

import java.util.List;
import work.lcod.taskgen.model.EnvVar;
import work.lcod.taskgen.model.GitRepository;
import work.lcod.taskgen.model.Param;

/**
 * Build facts the injector derives step environment from.
 *
 * @param dockerRegistry registry host prefixed to pushed images
 * @param pipelineKind   kind id ({@code release}, {@code pullrequest}, ...)
 * @param context        pipeline context when a branch has several pipelines; may be blank
 * @param git            source repository, {@code null} when unknown
 * @param branch         branch being built
 * @param configEnv      pipeline-wide environment from the effective configuration
 * @param params         pipeline parameters exposed to every step
 */
public record InjectionContext(
    String dockerRegistry,
    String pipelineKind,
    String context,
    GitRepository git,
    String branch,
    List<EnvVar> configEnv,
    List<Param> params
) {
    public InjectionContext {
        configEnv = configEnv == null ? List.of() : List.copyOf(configEnv);
        params = params == null ? List.of() : List.copyOf(params);
    }
}
