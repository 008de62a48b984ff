package work.lcod.taskgen.cli;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.taskgen.api.CreateTaskOptions;
import work.lcod.taskgen.api.CreateTaskResults;
import work.lcod.taskgen.api.ProjectInputs;
import work.lcod.taskgen.api.TaskGenerator;
import work.lcod.taskgen.cluster.FileSystemClusterClient;
import work.lcod.taskgen.config.ConfigException;
import work.lcod.taskgen.config.PipelineConfig;
import work.lcod.taskgen.config.PipelineConfigLoader;
import work.lcod.taskgen.model.GitRepository;
import work.lcod.taskgen.model.PodTemplate;
import work.lcod.taskgen.shared.DurationParser;
import work.lcod.taskgen.version.ProcessCommandRunner;

@CommandLine.Command(
    name = "create-task",
    description = "Compile a build pack or declarative pipeline into tasks, a pipeline and a pipeline run.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CreateTaskCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CreateTaskCommand.class);

    @CommandLine.Option(names = {"-p", "--pack"}, description = "Build pack name; defaults to the project configuration's buildPack.")
    private String pack;

    @CommandLine.Option(names = {"-d", "--dir"}, description = "Project directory (default: current directory).")
    private Path dir;

    @CommandLine.Option(names = "--packs-dir", description = "Directory holding one sub-directory per build pack.")
    private Path packsDir;

    @CommandLine.Option(names = {"-u", "--url"}, description = "URL of the build pack git repository.")
    private String buildPackUrl;

    @CommandLine.Option(names = {"-r", "--ref"}, description = "Git reference of the build pack repository.")
    private String buildPackRef;

    @CommandLine.Option(names = {"-k", "--kind"}, defaultValue = CreateTaskOptions.DEFAULT_PIPELINE_KIND, description = "Pipeline kind: release, pullrequest or feature.")
    private String kind;

    @CommandLine.Option(names = {"-c", "--context"}, description = "Pipeline context when a repository has several pipelines.")
    private String context;

    @CommandLine.Option(names = {"-l", "--labels"}, description = "Custom label added to the generated objects (key=value).")
    private List<String> labels = new ArrayList<>();

    @CommandLine.Option(names = "--no-apply", description = "Do not apply the generated objects to the cluster.")
    private boolean noApply;

    @CommandLine.Option(names = {"-t", "--trigger"}, defaultValue = CreateTaskOptions.DEFAULT_TRIGGER, description = "Trigger type recorded on the pipeline run.")
    private String trigger;

    @CommandLine.Option(names = "--target-path", description = "Directory the source is checked out to (default: the source name).")
    private String targetPath;

    @CommandLine.Option(names = {"-s", "--source"}, defaultValue = CreateTaskOptions.DEFAULT_SOURCE_NAME, description = "Name of the source input resource.")
    private String sourceName;

    @CommandLine.Option(names = "--image", description = "Image overriding every compiled step's image.")
    private String customImage;

    @CommandLine.Option(names = "--docker-registry", description = "Docker registry host exposed to steps as DOCKER_REGISTRY.")
    private String dockerRegistry;

    @CommandLine.Option(names = "--git-url", description = "URL of the repository being built (default: --clone-git-url).")
    private String gitUrl;

    @CommandLine.Option(names = "--clone-git-url", description = "Git URL the sources were cloned from.")
    private String cloneGitUrl;

    @CommandLine.Option(names = {"-b", "--branch"}, description = "Branch being built.")
    private String branch;

    @CommandLine.Option(names = "--revision", description = "Git revision being built.")
    private String revision;

    @CommandLine.Option(names = "--pr-number", description = "Pull request number.")
    private String prNumber;

    @CommandLine.Option(names = "--delete-temp-dir", description = "The cloned sources live in a temporary directory that the caller deletes.")
    private boolean deleteTempDir;

    @CommandLine.Option(names = "--view", description = "Print the compiled steps without applying anything.")
    private boolean viewSteps;

    @CommandLine.Option(names = "--no-set-version", description = "Do not resolve a release or preview version.")
    private boolean noSetVersion;

    @CommandLine.Option(names = "--duration", defaultValue = "30s", description = "How long to retry creating the pipeline run (e.g. 30s, 1m).")
    private String duration;

    @CommandLine.Option(names = "--service-account", defaultValue = CreateTaskOptions.DEFAULT_SERVICE_ACCOUNT, description = "Service account the pipeline run executes as.")
    private String serviceAccount;

    @CommandLine.Option(names = {"-n", "--namespace"}, defaultValue = CreateTaskOptions.DEFAULT_NAMESPACE, description = "Namespace the objects are created in.")
    private String namespace;

    @CommandLine.Option(names = "--build-number", defaultValue = CreateTaskOptions.DEFAULT_BUILD_NUMBER, description = "Build number used in preview versions.")
    private String buildNumber;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Directory the generated YAML files are written to.")
    private Path outputDir;

    @CommandLine.Option(names = "--credentials-command", description = "Command of the git credentials step prepended to release pipelines.")
    private String credentialsCommand;

    @CommandLine.Option(names = "--param", description = "Custom pipeline parameter (name=value).")
    private Map<String, String> params = new LinkedHashMap<>();

    @CommandLine.Option(names = "--pod-templates", description = "YAML file mapping container names to pod templates.")
    private Path podTemplatesFile;

    @CommandLine.Option(names = "--cluster-dir", description = "Directory backing the local cluster store (default: <dir>/.taskgen/cluster).")
    private Path clusterDir;

    @Override
    public Integer call() {
        Path projectDir = (dir == null ? Path.of("") : dir).toAbsolutePath().normalize();
        Duration retryDuration = DurationParser.parse(duration)
            .orElseThrow(() -> new CommandLine.ParameterException(new CommandLine(this), "--duration must not be blank"));

        var loaded = PipelineConfigLoader.loadProjectConfig(projectDir, context);
        String packName = pack;
        if (packName == null || packName.isBlank()) {
            packName = loaded.config().buildPack();
        }
        PipelineConfig buildPackConfig = loadBuildPack(packName);

        var options = CreateTaskOptions.builder()
            .pack(packName)
            .dir(projectDir)
            .buildPackUrl(buildPackUrl)
            .buildPackRef(buildPackRef)
            .pipelineKind(kind)
            .context(context)
            .customLabels(labels)
            .noApply(noApply)
            .trigger(trigger)
            .targetPath(targetPath)
            .sourceName(sourceName)
            .customImage(customImage)
            .dockerRegistry(dockerRegistry)
            .cloneGitUrl(cloneGitUrl)
            .branch(branch)
            .revision(revision)
            .prNumber(prNumber)
            .deleteTempDir(deleteTempDir)
            .viewSteps(viewSteps)
            .noSetVersion(noSetVersion)
            .retryDuration(retryDuration)
            .serviceAccount(serviceAccount)
            .namespace(namespace)
            .buildNumber(buildNumber)
            .outputDir(Optional.ofNullable(outputDir))
            .credentialsCommand(credentialsCommand)
            .customParams(params)
            .build();

        Map<String, PodTemplate> podTemplates = podTemplatesFile == null
            ? Map.of()
            : PipelineConfigLoader.loadPodTemplates(podTemplatesFile);
        var inputs = new ProjectInputs(buildPackConfig, loaded.pipelineConfig(), podTemplates, gitRepository());

        Path storeDir = clusterDir == null ? projectDir.resolve(".taskgen").resolve("cluster") : clusterDir;
        var generator = new TaskGenerator(new FileSystemClusterClient(storeDir), new ProcessCommandRunner());
        CreateTaskResults results = generator.generate(options, inputs);
        if (results.applied()) {
            for (var reference : results.objectReferences()) {
                log.info("applied {} {}/{}", reference.kind(), reference.namespace(), reference.name());
            }
        }
        return 0;
    }

    private PipelineConfig loadBuildPack(String packName) {
        if (packName == null || packName.isBlank() || PipelineConfigLoader.NO_BUILD_PACK.equals(packName)) {
            return null;
        }
        if (packsDir == null) {
            throw new ConfigException("--packs-dir is required to load build pack " + packName);
        }
        log.debug("Loading build pack {} from {} (url={}, ref={})", packName, packsDir, buildPackUrl, buildPackRef);
        return PipelineConfigLoader.loadBuildPack(packsDir, packName);
    }

    private GitRepository gitRepository() {
        String url = gitUrl != null && !gitUrl.isBlank() ? gitUrl : cloneGitUrl;
        if (url == null || url.isBlank()) {
            log.warn("No git URL given; use --git-url or --clone-git-url");
            return null;
        }
        try {
            return GitRepository.parse(url);
        } catch (IllegalArgumentException ex) {
            throw new ConfigException("Failed to parse git URL " + url + ": " + ex.getMessage(), ex);
        }
    }
}
