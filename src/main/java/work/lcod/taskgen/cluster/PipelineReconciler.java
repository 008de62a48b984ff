package work.lcod.taskgen.cluster;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.taskgen.graph.CrdGraph;
import work.lcod.taskgen.model.ApiVersions;
import work.lcod.taskgen.model.ObjectMeta;
import work.lcod.taskgen.model.OwnerReference;
import work.lcod.taskgen.model.Pipeline;
import work.lcod.taskgen.model.PipelineResource;
import work.lcod.taskgen.model.PipelineRun;
import work.lcod.taskgen.model.PipelineStructure;
import work.lcod.taskgen.model.Task;

/**
 * Applies a task graph to the cluster in a fixed order: resources, tasks, pipeline, run, structure.
 *
 * <p>Objects applied before a failure stay in the cluster; applying the same graph again is the
 * recovery path. A structure that cannot be stored after its run was created is reported as
 * {@link StructurePersistException}; the run is not deleted.
 */
public final class PipelineReconciler {
    private static final Logger log = LoggerFactory.getLogger(PipelineReconciler.class);

    private final ClusterClient client;
    private final RetryPolicy runRetry;

    public PipelineReconciler(ClusterClient client, RetryPolicy runRetry) {
        this.client = client;
        this.runRetry = runRetry;
    }

    public ApplyResults apply(CrdGraph graph, ApplyRequest request) {
        String ns = request.namespace();
        boolean mutate = !request.noApply();

        var resources = new ArrayList<PipelineResource>();
        var bindings = new ArrayList<PipelineRun.ResourceBinding>();
        for (PipelineResource resource : graph.resources()) {
            PipelineResource namespaced = resource.withMetadata(resource.metadata().withNamespace(ns));
            if (mutate) {
                PipelineResource toApply = namespaced;
                namespaced = call(
                    () -> client.createOrUpdateResource(ns, toApply),
                    "create/update PipelineResource " + resource.name() + " in namespace " + ns
                );
                if (ApiVersions.RESOURCE_TYPE_GIT.equals(resource.type())) {
                    log.info("upserted PipelineResource {} for the git repository {}",
                        resource.name(), resource.param("url").orElse(""));
                } else {
                    log.info("upserted PipelineResource {}", resource.name());
                }
            }
            resources.add(namespaced);
            bindings.add(new PipelineRun.ResourceBinding(
                resource.name(),
                new PipelineRun.ResourceRef(resource.name(), resource.apiVersion())
            ));
        }

        var tasks = new ArrayList<Task>();
        for (Task task : graph.tasks()) {
            Task namespaced = task.withMetadata(task.metadata().withNamespace(ns));
            if (mutate) {
                Task toApply = namespaced;
                namespaced = call(
                    () -> client.createOrUpdateTask(ns, toApply),
                    "create/update the task " + task.name() + " in namespace " + ns
                );
                log.info("upserted Task {}", task.name());
            }
            tasks.add(namespaced);
        }

        Pipeline pipeline = graph.pipeline().withDefaultTypeMeta();
        pipeline = pipeline.withMetadata(pipeline.metadata().withNamespace(ns).withMergedLabels(graph.labels()));
        if (mutate) {
            Pipeline toApply = pipeline;
            pipeline = call(
                () -> client.createOrUpdatePipeline(ns, toApply),
                "create/update the Pipeline " + toApply.name() + " in namespace " + ns
            );
            log.info("upserted Pipeline {}", pipeline.name());
        }

        PipelineRun run = buildRun(pipeline, bindings, graph, request);
        if (mutate) {
            PipelineRun toCreate = run;
            run = runRetry.execute(
                "create the PipelineRun " + run.name() + " in namespace " + ns,
                () -> client.createPipelineRun(ns, toCreate)
            );
            log.info("created PipelineRun {}", run.name());
        }

        Optional<PipelineStructure> structure = graph.structure().map(s -> stampStructure(s, ns, graph.pipeline().name()));
        if (structure.isPresent()) {
            structure = Optional.of(linkStructure(structure.get(), run, OwnerReference.toPipeline(pipeline)));
            if (mutate) {
                PipelineStructure toCreate = structure.get();
                try {
                    structure = Optional.of(client.createPipelineStructure(ns, toCreate));
                } catch (RuntimeException ex) {
                    throw new StructurePersistException(
                        run.name(),
                        "Failed to create the PipelineStructure " + toCreate.name() + " in namespace " + ns
                            + "; PipelineRun " + run.name() + " was created but cannot be traced: " + ex.getMessage(),
                        ex
                    );
                }
                log.info("created PipelineStructure {}", structure.get().name());
            }
        }
        return new ApplyResults(pipeline, tasks, resources, run, structure);
    }

    private PipelineRun buildRun(Pipeline pipeline, List<PipelineRun.ResourceBinding> bindings, CrdGraph graph, ApplyRequest request) {
        var metadata = new ObjectMeta(
            pipeline.name(),
            request.namespace(),
            null,
            graph.labels(),
            List.of(OwnerReference.toPipeline(pipeline))
        );
        var spec = new PipelineRun.Spec(
            request.serviceAccount(),
            new PipelineRun.Trigger(request.trigger()),
            new PipelineRun.PipelineRef(pipeline.name(), pipeline.apiVersion()),
            bindings,
            graph.params()
        );
        return PipelineRun.of(metadata, spec);
    }

    private static PipelineStructure stampStructure(PipelineStructure structure, String ns, String pipelineName) {
        String pipelineRef = structure.pipelineRef() == null ? pipelineName : structure.pipelineRef();
        return structure.withMetadata(structure.metadata().withNamespace(ns)).withRefs(pipelineRef, structure.pipelineRunRef());
    }

    private static PipelineStructure linkStructure(PipelineStructure structure, PipelineRun run, OwnerReference owner) {
        ObjectMeta metadata = structure.metadata().withName(run.name()).withOwnerReferences(List.of(owner));
        return structure.withMetadata(metadata).withRefs(structure.pipelineRef(), run.name());
    }

    private static <T> T call(Supplier<T> action, String description) {
        try {
            return action.get();
        } catch (ApplyException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ApplyException("Failed to " + description + ": " + ex.getMessage(), ex);
        }
    }
}
