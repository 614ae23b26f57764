package org.loxlang.runtime.model;

import java.math.BigDecimal;

/**
 * Operations on runtime values.
 * <p>
 * Values are plain Java objects: {@code null} is nil, {@link Boolean}, {@link Double} for
 * numbers, {@link String}, and the model types {@link LoxFunction}, {@link BoundMethod},
 * {@link LoxClass}, {@link LoxInstance} and native functions.
 */
public final class Values {

    private Values() {
    }

    /**
     * Only nil and false are falsy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        return true;
    }

    /**
     * Equality as defined by {@code ==}: values of different kinds are never equal, numbers use
     * IEEE-754 comparison (so NaN is not equal to itself), strings compare by content, and
     * functions, classes and instances by identity.
     */
    public static boolean isEqual(Object a, Object b) {
        if (a == null) return b == null;
        if (b == null) return false;
        if (a instanceof Double x && b instanceof Double y) {
            return x.doubleValue() == y.doubleValue();
        }
        if (a instanceof String || a instanceof Boolean) {
            return a.equals(b);
        }
        return a == b;
    }

    /**
     * Converts a value to the text {@code print} writes.
     */
    public static String stringify(Object value) {
        if (value == null) return "nil";

        if (value instanceof Double number) {
            if (number.isInfinite()) {
                return number > 0 ? "inf" : "-inf";
            }
            if (number.isNaN() || number == 0.0) {
                String text = number.toString();
                return text.endsWith(".0") ? text.substring(0, text.length() - 2) : text;
            }
            // Plain notation, so 1e7 prints as 10000000 and 0.5 as 0.5.
            return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
        }

        return value.toString();
    }

    /**
     * Gets the name of a value's runtime kind, as returned by the {@code type} built-in.
     */
    public static String typeName(Object value) {
        if (value == null) return "nil";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Double) return "number";
        if (value instanceof String) return "string";
        if (value instanceof LoxClass) return "class";
        if (value instanceof LoxInstance) return "instance";
        if (value instanceof LoxCallable) return "function";
        throw new IllegalArgumentException("Not a runtime value: " + value.getClass().getName());
    }
}
