package alertmigrator.translate;

import alertmigrator.exceptions.InvalidAlertSettingsException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the duration strings found in legacy alert settings.
 *
 * <p>Accepts compound durations such as {@code 90s}, {@code 1h30m} or
 * {@code 2d}, and relative time expressions such as {@code now-5m} or
 * {@code now}. Units: {@code ms, s, m, h, d, w, y}.
 */
public final class DurationParser {

    private static final Pattern PART = Pattern.compile("(\\d+)(ms|s|m|h|d|w|y)");

    private DurationParser() {}

    /**
     * Parses a duration into whole seconds. Milliseconds are truncated.
     *
     * @param value the duration, may start with {@code now-}
     * @return the duration in seconds; {@code now} and blank values yield 0
     * @throws InvalidAlertSettingsException if the value is not a duration or overflows
     */
    public static long parseSeconds(String value) throws InvalidAlertSettingsException {
        if (value == null) return 0;
        String s = value.trim();
        if (s.isEmpty() || s.equals("now")) return 0;
        if (s.startsWith("now-")) s = s.substring(4);

        Matcher m = PART.matcher(s);
        long millis = 0;
        int end = 0;
        while (m.find()) {
            if (m.start() != end) {
                throw new InvalidAlertSettingsException("invalid duration: " + value);
            }
            try {
                millis = Math.addExact(millis,
                        Math.multiplyExact(Long.parseLong(m.group(1)), unitMillis(m.group(2))));
            } catch (NumberFormatException | ArithmeticException e) {
                throw new InvalidAlertSettingsException("invalid duration: " + value, e);
            }
            end = m.end();
        }
        if (end == 0 || end != s.length()) {
            throw new InvalidAlertSettingsException("invalid duration: " + value);
        }
        return millis / 1000;
    }

    private static long unitMillis(String unit) {
        return switch (unit) {
            case "ms" -> 1L;
            case "s" -> 1_000L;
            case "m" -> 60_000L;
            case "h" -> 3_600_000L;
            case "d" -> 86_400_000L;
            case "w" -> 7 * 86_400_000L;
            case "y" -> 365 * 86_400_000L;
            default -> throw new IllegalArgumentException(unit);
        };
    }
}
