package work.lcod.taskgen.shared;

import java.util.List;

/**
 * A declarative pipeline or a generated object failed structural validation.
 */
public class ValidationException extends TaskGenerationException {
    private final List<String> problems;

    public ValidationException(String subject, List<String> problems) {
        super("Validation failed for " + subject + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
