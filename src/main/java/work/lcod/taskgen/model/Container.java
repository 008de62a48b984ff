package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;

/**
 * A container shape. Pod templates supply the defaults; a compiled step is a fully resolved container.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Container(
    String name,
    String image,
    List<String> command,
    List<String> args,
    String workingDir,
    List<EnvVar> env,
    List<VolumeMount> volumeMounts
) {
    public Container {
        command = command == null ? List.of() : List.copyOf(command);
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? List.of() : List.copyOf(env);
        volumeMounts = volumeMounts == null ? List.of() : List.copyOf(volumeMounts);
    }

    public Container withName(String value) {
        return new Container(value, image, command, args, workingDir, env, volumeMounts);
    }

    public Container withImage(String value) {
        return new Container(name, value, command, args, workingDir, env, volumeMounts);
    }

    public Container withCommand(List<String> commandValue, List<String> argsValue) {
        return new Container(name, image, commandValue, argsValue, workingDir, env, volumeMounts);
    }

    public Container withWorkingDir(String value) {
        return new Container(name, image, command, args, value, env, volumeMounts);
    }

    public Container withEnv(List<EnvVar> value) {
        return new Container(name, image, command, args, workingDir, value, volumeMounts);
    }

    public Container withVolumeMounts(List<VolumeMount> value) {
        return new Container(name, image, command, args, workingDir, env, value);
    }

    /**
     * Command followed by its arguments, as a single line.
     */
    public String commandLine() {
        var parts = new ArrayList<String>(command);
        parts.addAll(args);
        return String.join(" ", parts);
    }
}
