package work.lcod.taskgen.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.EnvVar;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.model.Volume;
import work.lcod.taskgen.model.VolumeMount;

/**
 * Adds the build environment and the pod metadata volume to a step. Values already present on the
 * step always win and reserved names are removed from every source, so running the injector again
 * changes nothing.
 */
public final class EnvironmentInjector {
    public static final String POD_INFO_VOLUME = "podinfo";
    public static final String POD_INFO_MOUNT_PATH = "/etc/podinfo";
    public static final Set<String> DEFAULT_RESERVED_VARIABLES = Set.of("JENKINS_URL");

    private final Set<String> reservedVariables;

    public EnvironmentInjector() {
        this(DEFAULT_RESERVED_VARIABLES);
    }

    public EnvironmentInjector(Set<String> reservedVariables) {
        this.reservedVariables = Set.copyOf(reservedVariables);
    }

    public Container inject(Container step, InjectionContext context) {
        var env = new ArrayList<EnvVar>();
        for (EnvVar entry : step.env()) {
            if (!reservedVariables.contains(entry.name())) {
                env.add(entry);
            }
        }
        for (EnvVar entry : context.configEnv()) {
            addIfAbsent(env, entry);
        }
        addIfAbsent(env, "DOCKER_REGISTRY", context.dockerRegistry());
        if (notBlank(context.pipelineKind())) {
            addIfAbsent(env, "PIPELINE_KIND", context.pipelineKind());
        }
        if (notBlank(context.context())) {
            addIfAbsent(env, "PIPELINE_CONTEXT", context.context());
        }
        String branch = context.branch();
        if (context.git() != null) {
            String owner = context.git().organisation();
            String repo = context.git().name();
            if (notBlank(context.git().cloneUrl())) {
                addIfAbsent(env, "SOURCE_URL", context.git().cloneUrl());
            }
            if (notBlank(owner)) {
                addIfAbsent(env, "REPO_OWNER", owner);
            }
            if (notBlank(repo)) {
                addIfAbsent(env, "REPO_NAME", repo);
            }
            if (notBlank(owner) && notBlank(repo) && notBlank(branch)) {
                addIfAbsent(env, "JOB_NAME", owner + "/" + repo + "/" + branch);
            }
        }
        if (notBlank(branch)) {
            addIfAbsent(env, "BRANCH_NAME", branch);
        }
        addIfAbsent(env, "BATCH_MODE", "true");
        for (Param param : context.params()) {
            addIfAbsent(env, param.name().toUpperCase(Locale.ROOT), "${inputs.params." + param.name() + "}");
        }
        return step.withEnv(env);
    }

    /**
     * Adds the pod metadata volume to {@code volumes} and its mount to {@code step}, each only once.
     */
    public VolumeInjection injectVolumes(Container step, List<Volume> volumes) {
        var answer = new ArrayList<Volume>(volumes == null ? List.of() : volumes);
        if (answer.stream().noneMatch(v -> POD_INFO_VOLUME.equals(v.name()))) {
            answer.add(podInfoVolume());
        }
        Container container = step;
        if (step.volumeMounts().stream().noneMatch(m -> POD_INFO_VOLUME.equals(m.name()))) {
            var mounts = new ArrayList<VolumeMount>(step.volumeMounts());
            mounts.add(new VolumeMount(POD_INFO_VOLUME, POD_INFO_MOUNT_PATH, true));
            container = step.withVolumeMounts(mounts);
        }
        return new VolumeInjection(container, answer);
    }

    /**
     * Volume and environment injection in one call.
     */
    public VolumeInjection inject(Container step, List<Volume> volumes, InjectionContext context) {
        VolumeInjection withVolumes = injectVolumes(step, volumes);
        return new VolumeInjection(inject(withVolumes.container(), context), withVolumes.volumes());
    }

    /**
     * Appends {@code extra} volumes whose names are not yet in {@code volumes}.
     */
    public static List<Volume> combineVolumes(List<Volume> volumes, List<Volume> extra) {
        var answer = new ArrayList<Volume>(volumes);
        for (Volume volume : extra) {
            if (answer.stream().noneMatch(v -> v.name().equals(volume.name()))) {
                answer.add(volume);
            }
        }
        return answer;
    }

    private static Volume podInfoVolume() {
        return Volume.downwardApi(POD_INFO_VOLUME, List.of(
            new Volume.DownwardApiItem("labels", new Volume.FieldRef("metadata.labels"))
        ));
    }

    private void addIfAbsent(List<EnvVar> env, String name, String value) {
        addIfAbsent(env, new EnvVar(name, value == null ? "" : value));
    }

    // Reserved names are never added back, whatever their origin.
    private void addIfAbsent(List<EnvVar> env, EnvVar entry) {
        if (reservedVariables.contains(entry.name())) {
            return;
        }
        if (env.stream().noneMatch(e -> e.name().equals(entry.name()))) {
            env.add(entry);
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    public record VolumeInjection(Container container, List<Volume> volumes) {
        public VolumeInjection {
            volumes = List.copyOf(volumes);
        }
    }
}
