package work.lcod.taskgen.config;

import work.lcod.taskgen.shared.TaskGenerationException;

/**
 * Missing or invalid pipeline configuration (absent kind, no default container, malformed label, unreadable file).
 */
public class ConfigException extends TaskGenerationException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
