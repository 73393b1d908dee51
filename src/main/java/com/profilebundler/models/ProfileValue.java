package com.profilebundler.models;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A numeric property value with an optional {@code %} or {@code mm} suffix.
 * Remembers whether it was written without a decimal point so arithmetic can
 * keep integer values integral.
 */
public final class ProfileValue {

    public enum Unit {
        NONE(""),
        PERCENT("%"),
        MILLIMETER("mm");

        private final String suffix;

        Unit(String suffix) {
            this.suffix = suffix;
        }

        public String getSuffix() {
            return suffix;
        }

        public static Unit fromSuffix(String suffix) {
            if (suffix == null || suffix.isEmpty()) return NONE;
            for (Unit unit : values()) {
                if (unit.suffix.equals(suffix)) {
                    return unit;
                }
            }
            throw new IllegalArgumentException("Unknown unit: " + suffix);
        }
    }

    private static final Pattern VALUE_PATTERN = Pattern.compile("^(\\d+\\.?\\d*|\\.\\d+)(%|mm)?$");

    private final BigDecimal magnitude;
    private final Unit unit;
    private final boolean integral;

    public ProfileValue(BigDecimal magnitude, Unit unit, boolean integral) {
        if (magnitude == null || unit == null) {
            throw new IllegalArgumentException("Magnitude and unit are required");
        }
        this.magnitude = magnitude;
        this.unit = unit;
        this.integral = integral;
    }

    public static ProfileValue parse(String text) throws ProfileValueException {
        if (text == null) {
            throw new ProfileValueException("Invalid value format: (not set)");
        }
        Matcher matcher = VALUE_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new ProfileValueException("Invalid value format: " + text);
        }
        String number = matcher.group(1);
        return new ProfileValue(new BigDecimal(number), Unit.fromSuffix(matcher.group(2)), number.indexOf('.') < 0);
    }

    public BigDecimal getMagnitude() {
        return magnitude;
    }

    public Unit getUnit() {
        return unit;
    }

    public boolean isIntegral() {
        return integral;
    }

    /**
     * Adds a signed delta expressed in the given unit. Unitless results never go below zero.
     *
     * @throws ProfileValueException if the delta's unit differs from this value's unit
     */
    public ProfileValue adjust(BigDecimal delta, Unit deltaUnit) throws ProfileValueException {
        if (deltaUnit != unit) {
            throw new ProfileValueException("Unit mismatch: expected '" + unit.getSuffix()
                + "', got '" + deltaUnit.getSuffix() + "'");
        }
        BigDecimal result = magnitude.add(delta);
        if (unit == Unit.NONE && result.signum() < 0) {
            result = BigDecimal.ZERO;
        }
        boolean stillIntegral = integral && isWhole(result);
        return new ProfileValue(result, unit, stillIntegral);
    }

    /**
     * Integral values print without a decimal point; others are rounded to
     * {@code scale} digits and keep at least one fractional digit.
     */
    public String format(int scale) {
        if (integral && isWhole(magnitude)) {
            return magnitude.setScale(0, RoundingMode.UNNECESSARY).toPlainString() + unit.getSuffix();
        }
        BigDecimal rounded = magnitude.setScale(Math.max(scale, 1), RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.scale() < 1) {
            rounded = rounded.setScale(1, RoundingMode.UNNECESSARY);
        }
        return rounded.toPlainString() + unit.getSuffix();
    }

    private static boolean isWhole(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    @Override
    public String toString() {
        return format(6);
    }
}
