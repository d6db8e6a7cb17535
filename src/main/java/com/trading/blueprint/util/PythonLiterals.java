package com.trading.blueprint.util;

import java.math.BigDecimal;

/**
 * Renders parameter values as text of the generated strategy source.
 */
public final class PythonLiterals {
    private PythonLiterals() {
    }

    /**
     * Plain textual form used when a value is substituted into an expression:
     * {@code True}/{@code False} for booleans, floats keep their fractional
     * part, everything else via {@code toString()}. {@code null} renders as
     * {@code None}.
     */
    public static String text(Object value) {
        if (value == null)
            return "None";
        if (value instanceof Boolean b)
            return b ? "True" : "False";
        if (value instanceof Double || value instanceof Float)
            return floatText(((Number) value).doubleValue());
        return value.toString();
    }

    /**
     * Literal form used for class attributes: like {@link #text(Object)} but
     * strings are quoted.
     */
    public static String repr(Object value) {
        if (value instanceof CharSequence s)
            return quote(s.toString());
        return text(value);
    }

    static String floatText(double d) {
        if (Double.isNaN(d))
            return "float('nan')";
        if (Double.isInfinite(d))
            return d > 0 ? "float('inf')" : "-float('inf')";
        if (d == Math.rint(d)) {
            if (Math.abs(d) < 1e16)
                return (long) d + ".0";
            return exponentText(d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    /** Python's spelling of a large float: {@code 1e+20}, {@code 1.5e+17}. */
    private static String exponentText(double d) {
        String s = Double.toString(d);
        int e = s.indexOf('E');
        String mantissa = s.substring(0, e);
        if (mantissa.endsWith(".0"))
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        String exponent = s.substring(e + 1);
        return mantissa + "e+" + (exponent.length() < 2 ? "0" + exponent : exponent);
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('\'');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }
}
