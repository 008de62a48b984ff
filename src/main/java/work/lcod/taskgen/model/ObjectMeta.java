package work.lcod.taskgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name, namespace, labels and ownership of a generated object.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ObjectMeta(
    String name,
    String namespace,
    String uid,
    Map<String, String> labels,
    List<OwnerReference> ownerReferences
) {
    public ObjectMeta {
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        ownerReferences = ownerReferences == null ? List.of() : List.copyOf(ownerReferences);
    }

    public static ObjectMeta named(String name) {
        return new ObjectMeta(name, null, null, Map.of(), List.of());
    }

    public static ObjectMeta named(String name, Map<String, String> labels) {
        return new ObjectMeta(name, null, null, labels, List.of());
    }

    public ObjectMeta withName(String value) {
        return new ObjectMeta(value, namespace, uid, labels, ownerReferences);
    }

    public ObjectMeta withNamespace(String value) {
        return new ObjectMeta(name, value, uid, labels, ownerReferences);
    }

    public ObjectMeta withUid(String value) {
        return new ObjectMeta(name, namespace, value, labels, ownerReferences);
    }

    /**
     * Returns a copy whose labels are this object's labels overlaid with {@code extra}.
     */
    public ObjectMeta withMergedLabels(Map<String, String> extra) {
        var merged = new LinkedHashMap<>(labels);
        if (extra != null) {
            merged.putAll(extra);
        }
        return new ObjectMeta(name, namespace, uid, merged, ownerReferences);
    }

    public ObjectMeta withOwnerReferences(List<OwnerReference> value) {
        return new ObjectMeta(name, namespace, uid, labels, value);
    }
}
