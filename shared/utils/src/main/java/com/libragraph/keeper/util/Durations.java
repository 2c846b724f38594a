package com.libragraph.keeper.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats durations in the compact unit notation used by environment
 * overrides ({@code 1m30s}, {@code 500ms}, {@code 1.5h}). ISO-8601 ({@code PT10S}) is
 * accepted as well.
 */
public final class Durations {

    private static final Pattern COMPONENT = Pattern.compile("(\\d*\\.?\\d*)(ns|us|µs|μs|ms|s|m|h)");

    private static final Map<String, Long> NANOS_PER_UNIT = Map.of(
            "ns", 1L,
            "us", 1_000L,
            "µs", 1_000L,
            "μs", 1_000L,
            "ms", 1_000_000L,
            "s", 1_000_000_000L,
            "m", 60_000_000_000L,
            "h", 3_600_000_000_000L
    );

    private Durations() {
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid duration
     */
    public static Duration parse(String text) {
        Objects.requireNonNull(text, "duration text cannot be null");
        String s = text.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Invalid duration: empty string");
        }

        if (s.startsWith("P") || s.startsWith("p") || s.startsWith("-P") || s.startsWith("-p")) {
            try {
                return Duration.parse(s);
            } catch (DateTimeParseException | ArithmeticException e) {
                throw new IllegalArgumentException("Invalid duration: " + text, e);
            }
        }

        boolean negative = false;
        if (s.startsWith("-") || s.startsWith("+")) {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        if (s.equals("0")) {
            return Duration.ZERO;
        }

        BigDecimal totalNanos = BigDecimal.ZERO;
        Matcher m = COMPONENT.matcher(s);
        int pos = 0;
        while (pos < s.length()) {
            if (!m.find(pos) || m.start() != pos) {
                throw new IllegalArgumentException("Invalid duration: " + text);
            }
            String number = m.group(1);
            if (number.isEmpty() || number.equals(".")) {
                throw new IllegalArgumentException("Invalid duration (missing number): " + text);
            }
            BigDecimal value = new BigDecimal(number.endsWith(".") ? number + "0" : number);
            totalNanos = totalNanos.add(value.multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(m.group(2)))));
            pos = m.end();
        }

        long nanos;
        try {
            nanos = totalNanos.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Invalid duration (overflow): " + text, e);
        }
        return Duration.ofNanos(negative ? -nanos : nanos);
    }

    /**
     * Formats a duration the way it is parsed: {@code 0s}, {@code 500ms}, {@code 1m30s},
     * {@code 1h0m0s}.
     */
    public static String format(Duration duration) {
        Objects.requireNonNull(duration, "duration cannot be null");
        if (duration.isZero()) {
            return "0s";
        }

        StringBuilder sb = new StringBuilder();
        if (duration.isNegative()) {
            sb.append('-');
            duration = duration.negated();
        }

        if (duration.compareTo(Duration.ofSeconds(1)) < 0) {
            long nanos = duration.toNanos();
            if (nanos < 1_000L) {
                return sb.append(nanos).append("ns").toString();
            } else if (nanos < 1_000_000L) {
                return sb.append(fraction(nanos, 1_000L)).append("µs").toString();
            }
            return sb.append(fraction(nanos, 1_000_000L)).append("ms").toString();
        }

        long hours = duration.toHours();
        int minutes = duration.toMinutesPart();
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (hours > 0 || minutes > 0) {
            sb.append(minutes).append('m');
        }
        long secondNanos = duration.toSecondsPart() * 1_000_000_000L + duration.toNanosPart();
        return sb.append(fraction(secondNanos, 1_000_000_000L)).append('s').toString();
    }

    private static String fraction(long value, long unit) {
        BigDecimal d = BigDecimal.valueOf(value).divide(BigDecimal.valueOf(unit)).stripTrailingZeros();
        return d.scale() < 0 ? d.setScale(0).toPlainString() : d.toPlainString();
    }
}
