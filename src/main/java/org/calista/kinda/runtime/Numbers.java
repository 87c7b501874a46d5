package org.calista.kinda.runtime;

/**
 * Operand conversion shared by the composed and direct paths.
 */
public final class Numbers {

    private Numbers() {
    }

    /**
     * Number, Boolean (1/0), Character digit or numeric String.
     *
     * @throws IllegalArgumentException when the value has no numeric reading
     */
    public static double toDouble(Object v) {
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d)) throw new IllegalArgumentException("NaN is not a usable operand");
            return d;
        }
        if (v instanceof Boolean b) return b ? 1.0 : 0.0;
        if (v instanceof Character c && Character.isDigit(c)) return Character.digit(c, 10);
        if (v instanceof CharSequence s) {
            String t = s.toString().trim();
            try {
                double d = Double.parseDouble(t);
                if (Double.isNaN(d)) throw new IllegalArgumentException("NaN is not a usable operand");
                return d;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a number: '" + t + "'", e);
            }
        }
        throw new IllegalArgumentException("not a number: " + (v == null ? "null" : v.getClass().getSimpleName()));
    }

    public static boolean isIntegral(Object v) {
        return v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte;
    }

    public static int toInt(double v) {
        if (v >= Integer.MAX_VALUE) return Integer.MAX_VALUE;
        if (v <= Integer.MIN_VALUE) return Integer.MIN_VALUE;
        return (int) Math.round(v);
    }

    /**
     * Truthiness for fuzzy booleans: Boolean as is, numbers non-zero, strings "true"/"false".
     *
     * @throws IllegalArgumentException for anything else
     */
    public static boolean toBoolean(Object v) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0.0;
        if (v instanceof CharSequence s) {
            String t = s.toString().trim();
            if (t.equalsIgnoreCase("true")) return true;
            if (t.equalsIgnoreCase("false")) return false;
        }
        throw new IllegalArgumentException("not a boolean: " + v);
    }
}
