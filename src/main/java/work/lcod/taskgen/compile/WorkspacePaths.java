package work.lcod.taskgen.compile;

import java.util.ArrayDeque;
import work.lcod.taskgen.model.GitRepository;

/**
 * Resolves step working directories against the workspace the source is cloned into.
 */
public final class WorkspacePaths {
    public static final String WORKSPACE_ROOT = "/workspace";
    static final String APP_NAME_PLACEHOLDER = "REPLACE_ME_APP_NAME";
    static final String ORG_PLACEHOLDER = "REPLACE_ME_ORG";

    private WorkspacePaths() {}

    public static String workspaceDir(String sourceName) {
        return join(WORKSPACE_ROOT, sourceName);
    }

    public static String substitutePlaceholders(String dir, GitRepository git) {
        if (dir == null || git == null) {
            return dir;
        }
        return dir.replace(APP_NAME_PLACEHOLDER, git.name()).replace(ORG_PLACEHOLDER, git.organisation());
    }

    /**
     * Absolute directories pass through; {@code ./x}, {@code x} and blank are placed under the workspace.
     */
    public static String resolve(String dir, String workspaceDir) {
        if (dir == null || dir.isBlank()) {
            return workspaceDir;
        }
        if (dir.startsWith("/")) {
            return normalize(dir);
        }
        String relative = dir.startsWith("./") ? dir.substring(2) : dir;
        return join(workspaceDir, relative);
    }

    private static String join(String parent, String child) {
        if (child == null || child.isBlank() || ".".equals(child)) {
            return normalize(parent);
        }
        return normalize(parent + "/" + child);
    }

    private static String normalize(String path) {
        var parts = new ArrayDeque<String>();
        for (String part : path.split("/")) {
            if (part.isEmpty() || ".".equals(part)) {
                continue;
            }
            if ("..".equals(part)) {
                parts.pollLast();
            } else {
                parts.addLast(part);
            }
        }
        return "/" + String.join("/", parts);
    }
}
