/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.schedule;

import com.intuitivedesigns.activationpoller.settings.ConfigurationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact duration strings used by {@code every} and {@code in} schedules.
 *
 * <p>Accepts a sequence of {@code <number><unit>} parts where unit is one of
 * {@code y M w d h m s ms}, e.g. {@code 5s}, {@code 2m30s}, {@code 1.5h}, {@code 500ms}.
 * A bare number means seconds. Years are 365 days, months 30 days.</p>
 */
public final class DurationExpression {

    private static final Pattern PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|[yMwdhms])");
    private static final Pattern WHOLE = Pattern.compile("(?:\\d+(?:\\.\\d+)?(?:ms|[yMwdhms]))+");
    private static final Pattern BARE = Pattern.compile("\\d+(?:\\.\\d+)?");

    private DurationExpression() {}

    public static Duration parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Duration expression must not be blank");
        }
        String s = expression.trim();

        final BigDecimal millis;
        if (BARE.matcher(s).matches()) {
            millis = new BigDecimal(s).multiply(BigDecimal.valueOf(1_000L));
        } else if (WHOLE.matcher(s).matches()) {
            BigDecimal total = BigDecimal.ZERO;
            Matcher m = PART.matcher(s);
            while (m.find()) {
                total = total.add(new BigDecimal(m.group(1)).multiply(BigDecimal.valueOf(unitMillis(m.group(2)))));
            }
            millis = total;
        } else {
            throw new ConfigurationException("Invalid duration '" + expression + "'. Expected e.g. 30s, 5m, 1h30m, 500ms");
        }

        final Duration d;
        try {
            d = Duration.ofMillis(millis.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            throw new ConfigurationException("Duration '" + expression + "' is too large", e);
        }
        if (d.isZero() || d.isNegative()) {
            throw new ConfigurationException("Duration '" + expression + "' must be positive");
        }
        return d;
    }

    private static long unitMillis(String unit) {
        return switch (unit) {
            case "ms" -> 1L;
            case "s" -> 1_000L;
            case "m" -> 60_000L;
            case "h" -> 3_600_000L;
            case "d" -> 86_400_000L;
            case "w" -> 7 * 86_400_000L;
            case "M" -> 30 * 86_400_000L;
            case "y" -> 365 * 86_400_000L;
            default -> throw new ConfigurationException("Unknown duration unit '" + unit + "'");
        };
    }
}
