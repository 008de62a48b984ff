package work.lcod.taskgen.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.model.TaskParam;
import work.lcod.taskgen.shared.ValidationException;
import work.lcod.taskgen.version.VersionResolver;

/**
 * Ordered pipeline parameters with unique names.
 */
public final class ParameterSet {
    private final Map<String, Param> params = new LinkedHashMap<>();

    public static ParameterSet of(Collection<Param> params) {
        var set = new ParameterSet();
        params.forEach(set::add);
        return set;
    }

    public ParameterSet add(Param param) {
        if (params.containsKey(param.name())) {
            throw new ValidationException("pipeline parameters", List.of("duplicate parameter " + param.name()));
        }
        params.put(param.name(), param);
        return this;
    }

    public ParameterSet addAll(Collection<Param> values) {
        values.forEach(this::add);
        return this;
    }

    public Optional<String> value(String name) {
        return Optional.ofNullable(params.get(name)).map(Param::value);
    }

    public List<Param> toList() {
        return List.copyOf(params.values());
    }

    /**
     * Task input declarations for every parameter, each defaulting to the empty string.
     */
    public List<TaskParam> toTaskParams() {
        var answer = new ArrayList<TaskParam>(params.size());
        for (Param param : params.values()) {
            answer.add(new TaskParam(param.name(), describe(param.name()), ""));
        }
        return answer;
    }

    private static String describe(String name) {
        if (VersionResolver.VERSION_PARAM.equals(name)) {
            return "the version number for this release which is used as a tag on docker images";
        }
        if (VersionResolver.PREVIEW_VERSION_PARAM.equals(name)) {
            return "the version number for this preview which is used as a tag on docker images";
        }
        return "";
    }
}
