package work.lcod.taskgen.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.taskgen.cluster.RetryPolicy;

/**
 * Immutable options of one task generation run.
 *
 * <p>{@code buildPackUrl}, {@code buildPackRef}, {@code cloneGitUrl} and {@code deleteTempDir}
 * describe where the caller fetched the build pack and sources from; they are reported but the
 * fetching itself happens before {@link TaskGenerator} is invoked.
 */
public record CreateTaskOptions(
    String pack,
    Path dir,
    String buildPackUrl,
    String buildPackRef,
    String pipelineKind,
    String context,
    List<String> customLabels,
    boolean noApply,
    String trigger,
    String targetPath,
    String sourceName,
    String customImage,
    String dockerRegistry,
    String cloneGitUrl,
    String branch,
    String revision,
    String prNumber,
    boolean deleteTempDir,
    boolean viewSteps,
    boolean noSetVersion,
    Duration retryDuration,
    String serviceAccount,
    String namespace,
    String buildNumber,
    Optional<Path> outputDir,
    String credentialsCommand,
    Map<String, String> customParams
) {
    public static final String DEFAULT_PIPELINE_KIND = "release";
    public static final String DEFAULT_TRIGGER = "manual";
    public static final String DEFAULT_SOURCE_NAME = "source";
    public static final String DEFAULT_SERVICE_ACCOUNT = "tekton-bot";
    public static final String DEFAULT_NAMESPACE = "jx";
    public static final String DEFAULT_BUILD_NUMBER = "1";

    public CreateTaskOptions {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(pipelineKind, "pipelineKind");
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(retryDuration, "retryDuration");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(outputDir, "outputDir");
        customLabels = customLabels == null ? List.of() : List.copyOf(customLabels);
        customParams = customParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(customParams));
    }

    /**
     * Branch the pipeline is named after: the explicit branch, else {@code PR-<number>} for a pull
     * request number, else the revision.
     */
    public String effectiveBranch() {
        if (branch != null && !branch.isBlank()) {
            return branch;
        }
        if (prNumber != null && !prNumber.isBlank()) {
            return "PR-" + prNumber;
        }
        return revision;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String pack;
        private Path dir;
        private String buildPackUrl;
        private String buildPackRef;
        private String pipelineKind = DEFAULT_PIPELINE_KIND;
        private String context;
        private List<String> customLabels = List.of();
        private boolean noApply;
        private String trigger = DEFAULT_TRIGGER;
        private String targetPath;
        private String sourceName = DEFAULT_SOURCE_NAME;
        private String customImage;
        private String dockerRegistry;
        private String cloneGitUrl;
        private String branch;
        private String revision;
        private String prNumber;
        private boolean deleteTempDir;
        private boolean viewSteps;
        private boolean noSetVersion;
        private Duration retryDuration = RetryPolicy.DEFAULT_MAX_DURATION;
        private String serviceAccount = DEFAULT_SERVICE_ACCOUNT;
        private String namespace = DEFAULT_NAMESPACE;
        private String buildNumber = DEFAULT_BUILD_NUMBER;
        private Optional<Path> outputDir = Optional.empty();
        private String credentialsCommand;
        private Map<String, String> customParams = new LinkedHashMap<>();

        public Builder pack(String pack) {
            this.pack = pack;
            return this;
        }

        public Builder dir(Path dir) {
            this.dir = dir;
            return this;
        }

        public Builder buildPackUrl(String buildPackUrl) {
            this.buildPackUrl = buildPackUrl;
            return this;
        }

        public Builder buildPackRef(String buildPackRef) {
            this.buildPackRef = buildPackRef;
            return this;
        }

        public Builder pipelineKind(String pipelineKind) {
            this.pipelineKind = pipelineKind;
            return this;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public Builder customLabels(List<String> customLabels) {
            this.customLabels = customLabels;
            return this;
        }

        public Builder noApply(boolean noApply) {
            this.noApply = noApply;
            return this;
        }

        public Builder trigger(String trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder targetPath(String targetPath) {
            this.targetPath = targetPath;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder customImage(String customImage) {
            this.customImage = customImage;
            return this;
        }

        public Builder dockerRegistry(String dockerRegistry) {
            this.dockerRegistry = dockerRegistry;
            return this;
        }

        public Builder cloneGitUrl(String cloneGitUrl) {
            this.cloneGitUrl = cloneGitUrl;
            return this;
        }

        public Builder branch(String branch) {
            this.branch = branch;
            return this;
        }

        public Builder revision(String revision) {
            this.revision = revision;
            return this;
        }

        public Builder prNumber(String prNumber) {
            this.prNumber = prNumber;
            return this;
        }

        public Builder deleteTempDir(boolean deleteTempDir) {
            this.deleteTempDir = deleteTempDir;
            return this;
        }

        public Builder viewSteps(boolean viewSteps) {
            this.viewSteps = viewSteps;
            return this;
        }

        public Builder noSetVersion(boolean noSetVersion) {
            this.noSetVersion = noSetVersion;
            return this;
        }

        public Builder retryDuration(Duration retryDuration) {
            this.retryDuration = retryDuration;
            return this;
        }

        public Builder serviceAccount(String serviceAccount) {
            this.serviceAccount = serviceAccount;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder buildNumber(String buildNumber) {
            this.buildNumber = buildNumber;
            return this;
        }

        public Builder outputDir(Optional<Path> outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder credentialsCommand(String credentialsCommand) {
            this.credentialsCommand = credentialsCommand;
            return this;
        }

        public Builder customParam(String name, String value) {
            this.customParams.put(name, value);
            return this;
        }

        public Builder customParams(Map<String, String> customParams) {
            this.customParams = new LinkedHashMap<>(customParams);
            return this;
        }

        public CreateTaskOptions build() {
            return new CreateTaskOptions(
                pack,
                dir,
                buildPackUrl,
                buildPackRef,
                pipelineKind,
                context,
                customLabels,
                noApply,
                trigger,
                targetPath,
                sourceName,
                customImage,
                dockerRegistry,
                cloneGitUrl,
                branch,
                revision,
                prNumber,
                deleteTempDir,
                viewSteps,
                noSetVersion,
                retryDuration,
                serviceAccount,
                namespace,
                buildNumber,
                outputDir,
                credentialsCommand,
                customParams
            );
        }
    }
}
