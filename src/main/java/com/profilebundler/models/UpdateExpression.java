package com.profilebundler.models;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single property edit: {@code key=value} sets a value, {@code key==+N[unit]}
 * or {@code key==-N[unit]} adjusts the current numeric value.
 */
public final class UpdateExpression {

    public enum Kind {
        ABSOLUTE,
        RELATIVE
    }

    private static final Pattern RELATIVE = Pattern.compile("^(\\w+)==([+-])(\\d+\\.?\\d*|\\.\\d+)(%|mm)?$");
    private static final Pattern ABSOLUTE = Pattern.compile("^(\\w+)=(.+)$");

    private final Kind kind;
    private final String property;
    private final String value;
    private final BigDecimal delta;
    private final ProfileValue.Unit unit;

    private UpdateExpression(Kind kind, String property, String value, BigDecimal delta, ProfileValue.Unit unit) {
        this.kind = kind;
        this.property = property;
        this.value = value;
        this.delta = delta;
        this.unit = unit;
    }

    public static UpdateExpression absolute(String property, String value) {
        return new UpdateExpression(Kind.ABSOLUTE, property, value, null, null);
    }

    public static UpdateExpression relative(String property, BigDecimal delta, ProfileValue.Unit unit) {
        return new UpdateExpression(Kind.RELATIVE, property, null, delta, unit);
    }

    public static UpdateExpression parse(String expression) throws ProfileValueException {
        if (expression == null || expression.isBlank()) {
            throw new ProfileValueException("Empty update expression");
        }
        String trimmed = expression.trim();
        Matcher relative = RELATIVE.matcher(trimmed);
        if (relative.matches()) {
            BigDecimal amount = new BigDecimal(relative.group(3));
            if ("-".equals(relative.group(2))) {
                amount = amount.negate();
            }
            ProfileValue.Unit unit = relative.group(4) != null ? ProfileValue.Unit.fromSuffix(relative.group(4)) : null;
            return relative(relative.group(1), amount, unit);
        }
        if (trimmed.contains("==")) {
            throw new ProfileValueException("Invalid relative value format: " + expression);
        }
        Matcher absolute = ABSOLUTE.matcher(trimmed);
        if (absolute.matches()) {
            return absolute(absolute.group(1), absolute.group(2).trim());
        }
        throw new ProfileValueException("Invalid update expression: " + expression
            + " (expected property=value or property==+/-amount)");
    }

    public Kind getKind() {
        return kind;
    }

    public String getProperty() {
        return property;
    }

    public String getValue() {
        return value;
    }

    public BigDecimal getDelta() {
        return delta;
    }

    /**
     * Unit written in the expression, or null when the current value's unit applies.
     */
    public ProfileValue.Unit getUnit() {
        return unit;
    }

    @Override
    public String toString() {
        if (kind == Kind.ABSOLUTE) {
            return property + "=" + value;
        }
        String sign = delta.signum() < 0 ? "-" : "+";
        return property + "==" + sign + delta.abs().toPlainString() + (unit != null ? unit.getSuffix() : "");
    }
}
