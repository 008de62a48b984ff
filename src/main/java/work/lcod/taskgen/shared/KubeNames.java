package work.lcod.taskgen.shared;

import java.util.Locale;

/**
 * Builds object names the cluster accepts: lower case alphanumerics and single dashes.
 */
public final class KubeNames {
    private static final int MAX_RESOURCE_NAME_LENGTH = 31;

    private KubeNames() {}

    public static String toValidName(String name) {
        if (name == null) {
            return "";
        }
        var builder = new StringBuilder(name.length());
        boolean lastDash = false;
        for (char ch : name.toLowerCase(Locale.ROOT).toCharArray()) {
            boolean valid = (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9');
            if (valid) {
                builder.append(ch);
                lastDash = false;
            } else if (!lastDash) {
                builder.append('-');
                lastDash = true;
            }
        }
        return trimDashes(builder.toString());
    }

    public static String toValidNameTruncated(String name, int maxLength) {
        String valid = toValidName(name);
        if (valid.length() <= maxLength) {
            return valid;
        }
        return trimDashes(valid.substring(0, maxLength));
    }

    /**
     * Name shared by the generated pipeline, its build-pack task and its run: {@code org-repo-branch[-context]}.
     */
    public static String pipelineResourceName(String organisation, String repository, String branch, String context) {
        String dirty = organisation + "-" + repository + "-" + branch;
        if (context != null && !context.isBlank()) {
            dirty += "-" + context;
        }
        return toValidNameTruncated(dirty, MAX_RESOURCE_NAME_LENGTH);
    }

    private static String trimDashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }
}
