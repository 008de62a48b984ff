package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A pod volume. A source type that is not modelled here fails the load instead of being dropped.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Volume(
    String name,
    DownwardApiSource downwardAPI,
    SecretSource secret,
    HostPathSource hostPath,
    EmptyDirSource emptyDir,
    ConfigMapSource configMap,
    ClaimSource persistentVolumeClaim
) {

    public static Volume downwardApi(String name, List<DownwardApiItem> items) {
        return new Volume(name, new DownwardApiSource(items), null, null, null, null, null);
    }

    public static Volume secret(String name, String secretName) {
        return new Volume(name, null, new SecretSource(secretName, null, null), null, null, null, null);
    }

    public static Volume hostPath(String name, String path) {
        return new Volume(name, null, null, new HostPathSource(path, null), null, null, null);
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record DownwardApiSource(List<DownwardApiItem> items) {
        public DownwardApiSource {
            items = items == null ? List.of() : List.copyOf(items);
        }
    }

    public record DownwardApiItem(String path, FieldRef fieldRef) {}

    public record FieldRef(String fieldPath) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record KeyToPath(String key, String path) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SecretSource(String secretName, List<KeyToPath> items, Integer defaultMode) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HostPathSource(String path, String type) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EmptyDirSource(String medium, String sizeLimit) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ConfigMapSource(String name, List<KeyToPath> items, Integer defaultMode) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ClaimSource(String claimName, Boolean readOnly) {}
}
