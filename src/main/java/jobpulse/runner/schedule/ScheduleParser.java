package jobpulse.runner.schedule;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a schedule descriptor into a repeat interval.
 *
 * Recognised forms, case-insensitive:
 * <ul>
 * <li>{@code daily}, {@code weekly}, {@code hourly}</li>
 * <li>{@code every <N> minute[s]|hour[s]|day[s]} with N a positive integer</li>
 * </ul>
 * Anything else is unparsable; no default interval is ever substituted.
 */
public final class ScheduleParser {

    private static final Pattern EVERY = Pattern.compile("every\\s+(\\d+)\\s+(minute|hour|day)s?");

    private ScheduleParser() {
    }

    /**
     * @param descriptor schedule text, may be null
     * @return the interval, or empty when the descriptor is unparsable
     */
    public static Optional<Duration> parse(String descriptor) {
        if (descriptor == null) {
            return Optional.empty();
        }

        String s = descriptor.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "daily":
                return Optional.of(Duration.ofDays(1));
            case "weekly":
                return Optional.of(Duration.ofDays(7));
            case "hourly":
                return Optional.of(Duration.ofHours(1));
            default:
                break;
        }

        Matcher m = EVERY.matcher(s);
        if (!m.matches()) {
            return Optional.empty();
        }

        try {
            long n = Long.parseLong(m.group(1));
            if (n < 1) {
                return Optional.empty();
            }
            return Optional.of(switch (m.group(2)) {
                case "minute" -> Duration.ofMinutes(n);
                case "hour" -> Duration.ofHours(n);
                default -> Duration.ofDays(n);
            });
        } catch (NumberFormatException | ArithmeticException e) {
            // digits beyond long range, or an interval Duration cannot hold
            return Optional.empty();
        }
    }

    public static boolean isParsable(String descriptor) {
        return parse(descriptor).isPresent();
    }
}
