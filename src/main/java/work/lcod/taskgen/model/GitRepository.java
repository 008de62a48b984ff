package work.lcod.taskgen.model;

import java.util.Objects;

/**
 * Identity of the source repository a pipeline builds.
 */
public record GitRepository(String host, String organisation, String name, String cloneUrl) {
    public GitRepository {
        Objects.requireNonNull(organisation, "organisation");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Parses {@code https://host/org/repo(.git)} and {@code git@host:org/repo(.git)} URLs.
     */
    public static GitRepository parse(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Git URL must not be blank");
        }
        String trimmed = url.trim();
        String hostAndPath;
        String host;
        String path;
        if (trimmed.startsWith("git@")) {
            hostAndPath = trimmed.substring("git@".length());
            int colon = hostAndPath.indexOf(':');
            if (colon < 0) {
                throw new IllegalArgumentException("Unsupported git URL: " + url);
            }
            host = hostAndPath.substring(0, colon);
            path = hostAndPath.substring(colon + 1);
        } else {
            int scheme = trimmed.indexOf("://");
            if (scheme < 0) {
                throw new IllegalArgumentException("Unsupported git URL: " + url);
            }
            hostAndPath = trimmed.substring(scheme + 3);
            int slash = hostAndPath.indexOf('/');
            if (slash < 0) {
                throw new IllegalArgumentException("Git URL has no repository path: " + url);
            }
            host = hostAndPath.substring(0, slash);
            int at = host.lastIndexOf('@');
            if (at >= 0) {
                host = host.substring(at + 1);
            }
            path = hostAndPath.substring(slash + 1);
        }
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.endsWith(".git")) {
            path = path.substring(0, path.length() - 4);
        }
        int split = path.lastIndexOf('/');
        if (split <= 0 || split == path.length() - 1) {
            throw new IllegalArgumentException("Git URL must contain an organisation and a repository: " + url);
        }
        return new GitRepository(host, path.substring(0, split), path.substring(split + 1), trimmed);
    }

    public String httpsUrl() {
        if (host == null || host.isBlank()) {
            return cloneUrl;
        }
        return "https://" + host + "/" + organisation + "/" + name + ".git";
    }
}
