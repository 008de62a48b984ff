package work.lcod.taskgen.graph;

import java.util.List;
import java.util.Map;
import work.lcod.taskgen.model.ApiVersions;
import work.lcod.taskgen.model.GitRepository;
import work.lcod.taskgen.model.ObjectMeta;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.syntax.CrdGenerator;

final class ResourceFactory {
    static final String ORDERING_IMAGE = "alpine";

    private ResourceFactory() {}

    /**
     * Git resource for the source repository. The repository must have a clone URL.
     */
    static PipelineResource sourceRepository(String name, GitRepository git, String revision, boolean fromYaml) {
        Map<String, String> labels = fromYaml ? PipelineLabels.fromYamlLabels() : Map.of();
        return PipelineResource.of(
            ObjectMeta.named(name, labels),
            new PipelineResource.Spec(ApiVersions.RESOURCE_TYPE_GIT, List.of(
                new Param("revision", revision == null ? "" : revision),
                new Param("url", git.httpsUrl())
            ))
        );
    }

    // Only exists to chain tasks until the execution platform can order them itself.
    static PipelineResource tempOrdering() {
        return PipelineResource.of(
            ObjectMeta.named(CrdGenerator.TEMP_ORDERING_RESOURCE, PipelineLabels.fromYamlLabels()),
            new PipelineResource.Spec(ApiVersions.RESOURCE_TYPE_IMAGE, List.of(new Param("url", ORDERING_IMAGE)))
        );
    }
}
