package work.lcod.taskgen.cluster;

import java.util.Objects;

/**
 * @param namespace      namespace every object is created in
 * @param serviceAccount identity the pipeline run executes as
 * @param trigger        trigger type recorded on the run
 * @param noApply        skip every cluster mutation and only assemble the results
 */
public record ApplyRequest(String namespace, String serviceAccount, String trigger, boolean noApply) {
    public ApplyRequest {
        Objects.requireNonNull(namespace, "namespace");
    }
}
