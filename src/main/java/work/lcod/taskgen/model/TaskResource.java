package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TaskResource(String name, String type, String targetPath) {}
