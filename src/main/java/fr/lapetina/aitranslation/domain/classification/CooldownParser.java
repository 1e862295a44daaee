package fr.lapetina.aitranslation.domain.classification;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a retry delay from free-form provider error text.
 *
 * Recognizes "Please try again in 2m51.84s", "retry after 30s", "try again in 1h2m",
 * "try again in 750ms". The result is rounded up to a whole second so a retry never
 * lands a fraction of a second before the limit actually resets.
 */
public final class CooldownParser {

    private static final Pattern HINT = Pattern.compile(
            "(?:try again in|retry after)\\s*:?\\s*((?:\\d+(?:\\.\\d+)?\\s*(?:ms|h|m|s)\\s*)+)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern COMPONENT = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)\\s*(ms|h|m|s)",
            Pattern.CASE_INSENSITIVE);

    private static final BigDecimal MILLIS_PER_SECOND = BigDecimal.valueOf(1000);

    private CooldownParser() {
        // Utility class
    }

    /**
     * Parses the first retry hint in {@code text}.
     *
     * @return the delay rounded up to whole seconds, or empty when the text carries no hint
     */
    public static Optional<Duration> parse(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher hint = HINT.matcher(text);
        if (!hint.find()) {
            return Optional.empty();
        }

        BigDecimal totalMillis = BigDecimal.ZERO;
        Matcher component = COMPONENT.matcher(hint.group(1));
        while (component.find()) {
            BigDecimal value = new BigDecimal(component.group(1));
            totalMillis = totalMillis.add(value.multiply(unitMillis(component.group(2))));
        }

        long seconds = totalMillis.divide(MILLIS_PER_SECOND, 0, RoundingMode.CEILING).longValueExact();
        return Optional.of(Duration.ofSeconds(seconds));
    }

    /**
     * Parses the hint, falling back to {@code defaultCooldown}.
     */
    public static Duration parseOrDefault(String text, Duration defaultCooldown) {
        return parse(text).orElse(defaultCooldown);
    }

    private static BigDecimal unitMillis(String unit) {
        return switch (unit.toLowerCase()) {
            case "h" -> BigDecimal.valueOf(3_600_000);
            case "m" -> BigDecimal.valueOf(60_000);
            case "ms" -> BigDecimal.ONE;
            default -> MILLIS_PER_SECOND;
        };
    }
}
