package work.lcod.taskgen.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses retry durations written the way CI tooling usually prints them ({@code 30s}, {@code 2m},
 * {@code 1m30s}, {@code 500ms}). A bare number is read as seconds.
 */
public final class DurationParser {
    private static final Pattern SEGMENT = Pattern.compile("(\\d+)(ms|h|m|s)");
    private static final Pattern BARE_NUMBER = Pattern.compile("\\d+");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (BARE_NUMBER.matcher(trimmed).matches()) {
            return Optional.of(Duration.ofSeconds(Long.parseLong(trimmed)));
        }
        Matcher matcher = SEGMENT.matcher(trimmed);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                throw new IllegalArgumentException("Invalid duration: " + raw);
            }
            long value = Long.parseLong(matcher.group(1));
            total = total.plus(switch (matcher.group(2)) {
                case "ms" -> Duration.ofMillis(value);
                case "s" -> Duration.ofSeconds(value);
                case "m" -> Duration.ofMinutes(value);
                default -> Duration.ofHours(value);
            });
            consumed = matcher.end();
        }
        if (consumed == 0 || consumed != trimmed.length()) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        return Optional.of(total);
    }
}
