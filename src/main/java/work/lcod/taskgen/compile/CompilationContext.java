package work.lcod.taskgen.compile;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * State owned by a single compilation pass: the default step-name counter and the pod template
 * names that had to fall back to the default template. Create one per invocation; not thread safe.
 */
public final class CompilationContext {
    private final Set<String> missingPodTemplates = new TreeSet<>();
    private int stepCounter;

    int nextStepNumber() {
        stepCounter++;
        return stepCounter;
    }

    void recordMissingPodTemplate(String name) {
        missingPodTemplates.add(name);
    }

    public int stepCount() {
        return stepCounter;
    }

    public Set<String> missingPodTemplates() {
        return Collections.unmodifiableSet(missingPodTemplates);
    }
}
