package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A container environment variable: a literal {@code value} or a {@code valueFrom} reference.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnvVar(String name, String value, Source valueFrom) {

    @JsonCreator
    public EnvVar {}

    public EnvVar(String name, String value) {
        this(name, value, null);
    }

    public static EnvVar fromSecret(String name, String secretName, String key) {
        return new EnvVar(name, null, new Source(new KeySelector(secretName, key, null), null, null));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Source(KeySelector secretKeyRef, KeySelector configMapKeyRef, Volume.FieldRef fieldRef) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record KeySelector(String name, String key, Boolean optional) {}
}
