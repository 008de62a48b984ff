package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskParam(String name, String description, @JsonProperty("default") String defaultValue) {}
