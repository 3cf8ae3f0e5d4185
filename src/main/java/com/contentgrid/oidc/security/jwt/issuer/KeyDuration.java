package com.contentgrid.oidc.security.jwt.issuer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.util.StringUtils;

/**
 * A duration as it was supplied by the user, together with its parsed value.
 * <p>
 * Accepts the simple format ({@code 6h}, {@code 30m}, {@code 90s}), plain numbers (seconds), ISO-8601
 * ({@code PT6H}) and sequences of decimal numbers with a unit ({@code 1h30m}, {@code 1.5h}, {@code 300ms}). The
 * textual form is kept so configuration reads return exactly what was written.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class KeyDuration {

    /**
     * Longest accepted duration. Keeps creation instants plus a period, and rings of many periods, representable.
     */
    public static final Duration MAX_DURATION = Duration.ofDays(100 * 365);

    private static final Pattern UNIT_SEQUENCE = Pattern.compile("((\\d+(\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h|d))+");
    private static final Pattern UNIT_PART = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h|d)");

    private static final Map<String, BigDecimal> NANOS_PER_UNIT = Map.of(
            "ns", BigDecimal.ONE,
            "us", BigDecimal.valueOf(1_000L),
            "µs", BigDecimal.valueOf(1_000L),
            "ms", BigDecimal.valueOf(1_000_000L),
            "s", BigDecimal.valueOf(1_000_000_000L),
            "m", BigDecimal.valueOf(60L * 1_000_000_000L),
            "h", BigDecimal.valueOf(3_600L * 1_000_000_000L),
            "d", BigDecimal.valueOf(86_400L * 1_000_000_000L)
    );

    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

    @NonNull
    private final String text;

    @NonNull
    private final Duration duration;

    /**
     * @param field name of the configuration field, used in the error message
     * @param text the duration text
     * @throws InvalidKeyConfigurationException when the text is not a positive duration of at most
     * {@link #MAX_DURATION}
     */
    public static KeyDuration parse(String field, String text) {
        if (!StringUtils.hasText(text)) {
            throw new InvalidKeyConfigurationException("%s must not be empty".formatted(field));
        }
        var trimmed = text.trim();
        Duration duration;
        try {
            duration = parseDuration(trimmed);
        } catch (ArithmeticException e) {
            throw new InvalidKeyConfigurationException(
                    "%s must not exceed %s, got: %s".formatted(field, MAX_DURATION, text));
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyConfigurationException(
                    "unable to parse provided %s of: %s".formatted(field, text));
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new InvalidKeyConfigurationException(
                    "%s must be a positive duration, got: %s".formatted(field, text));
        }
        if (duration.compareTo(MAX_DURATION) > 0) {
            throw new InvalidKeyConfigurationException(
                    "%s must not exceed %s, got: %s".formatted(field, MAX_DURATION, text));
        }
        return new KeyDuration(trimmed, duration);
    }

    private static Duration parseDuration(String text) {
        try {
            return DurationStyle.detectAndParse(text, ChronoUnit.SECONDS);
        } catch (IllegalArgumentException e) {
            if (!UNIT_SEQUENCE.matcher(text).matches()) {
                throw e;
            }
            return parseUnitSequence(text);
        }
    }

    // Throws ArithmeticException when the total does not fit in a Duration
    private static Duration parseUnitSequence(String text) {
        var nanos = BigDecimal.ZERO;
        var matcher = UNIT_PART.matcher(text);
        while (matcher.find()) {
            var value = new BigDecimal(matcher.group(1));
            nanos = nanos.add(value.multiply(NANOS_PER_UNIT.get(matcher.group(2))));
        }
        var parts = nanos.setScale(0, RoundingMode.DOWN).divideAndRemainder(NANOS_PER_SECOND);
        return Duration.ofSeconds(parts[0].longValueExact(), parts[1].longValueExact());
    }

    @Override
    public String toString() {
        return this.text;
    }
}
