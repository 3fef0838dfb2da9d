package com.iptbrowser.feedsync.fetch;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves "10.9 hours ago" style text against a reference time.
 * A month counts as 30 days.
 */
public final class RelativeAgeParser {

    private static final Pattern AGE = Pattern.compile(
            "([\\d.]+)\\s*(minute|hour|day|week|month)s?\\s*ago", Pattern.CASE_INSENSITIVE);

    private RelativeAgeParser() {
    }

    /**
     * @return the matched age text, e.g. "1.2 days ago", if the input contains one
     */
    public static Optional<String> find(String text) {
        if (text == null) return Optional.empty();
        Matcher m = AGE.matcher(text);
        return m.find() ? Optional.of(m.group(0)) : Optional.empty();
    }

    /**
     * Subtract the age found in {@code text} from {@code now}.
     * Text without a recognisable age resolves to {@code now}.
     */
    public static LocalDateTime resolve(String text, LocalDateTime now) {
        if (text == null) return now;
        Matcher m = AGE.matcher(text);
        if (!m.find()) return now;

        double value;
        try {
            value = Double.parseDouble(m.group(1));
        } catch (NumberFormatException e) {
            return now;
        }

        long unitSeconds = switch (m.group(2).toLowerCase(Locale.ROOT)) {
            case "minute" -> 60L;
            case "hour" -> 3_600L;
            case "day" -> 86_400L;
            case "week" -> 7 * 86_400L;
            default -> 30 * 86_400L;
        };
        long millis = Math.round(value * unitSeconds * 1000);
        return now.minus(Duration.ofMillis(millis));
    }
}
