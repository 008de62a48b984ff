package work.lcod.taskgen.compile;

/**
 * Normalizes step command text coming from build pack libraries.
 */
public final class CommandText {
    private static final String LEGACY_VERSION_EXPORT = "export VERSION=`cat VERSION` && ";
    private static final String[] LEGACY_VERSION_READS = {"$(cat VERSION)", "$(cat ../VERSION)", "$(cat ../../VERSION)"};
    private static final String VERSION_VARIABLE = "${VERSION}";

    private CommandText() {}

    /**
     * Removes escaped {@code \$} and rewrites reads of the {@code VERSION} file to the {@code VERSION} variable.
     */
    public static String normalize(String command) {
        String answer = unescape(command);
        int export = answer.indexOf(LEGACY_VERSION_EXPORT);
        if (export >= 0) {
            answer = answer.substring(0, export) + answer.substring(export + LEGACY_VERSION_EXPORT.length());
        }
        for (String read : LEGACY_VERSION_READS) {
            answer = answer.replace(read, VERSION_VARIABLE);
        }
        return answer;
    }

    public static String unescape(String command) {
        return command == null ? "" : command.replace("\\$", "$");
    }
}
