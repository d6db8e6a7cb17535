package com.trading.blueprint.api;

/**
 * Schema entry for one editable node parameter.
 *
 * <p>
 * {@code min} and {@code max} apply to the numeric kinds only and may be
 * {@code null} when the range is open.
 */
public record ParameterDefinition(String name, ParameterKind kind, String label, Object defaultValue,
        Double min, Double max) {

    public ParameterDefinition {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Parameter name must not be blank");
        if (kind == null)
            throw new IllegalArgumentException("Parameter '" + name + "' needs a kind");
        if (label == null || label.isBlank())
            label = name;
        if (kind == ParameterKind.FLOAT && defaultValue instanceof Number n)
            defaultValue = Double.valueOf(n.doubleValue());
        else if (kind == ParameterKind.INT && defaultValue instanceof Number n)
            defaultValue = Integer.valueOf(n.intValue());
    }

    public static ParameterDefinition ofInt(String name, String label, int defaultValue, int min, int max) {
        return new ParameterDefinition(name, ParameterKind.INT, label, defaultValue, (double) min, (double) max);
    }

    public static ParameterDefinition ofFloat(String name, String label, Number defaultValue, double min,
            double max) {
        return new ParameterDefinition(name, ParameterKind.FLOAT, label, defaultValue, min, max);
    }

    /**
     * Converts an incoming value to this parameter's kind and clamps numeric
     * values into range. {@code null} passes through unchanged.
     *
     * @throws IllegalArgumentException if the value cannot be read as the kind
     */
    public Object coerce(Object value) {
        if (value == null)
            return null;
        return switch (kind) {
            case INT -> Integer.valueOf((int) clamp(toDouble(value)));
            case FLOAT -> Double.valueOf(clamp(toDouble(value)));
            case BOOL -> Boolean.valueOf(toBoolean(value));
            case STRING -> value.toString();
        };
    }

    private double clamp(double v) {
        if (min != null && v < min)
            return min;
        if (max != null && v > max)
            return max;
        return v;
    }

    private double toDouble(Object v) {
        if (v instanceof Number n)
            return n.doubleValue();
        if (v instanceof Boolean b)
            return b ? 1 : 0;
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' expects a number, got: " + v, e);
        }
    }

    private static boolean toBoolean(Object v) {
        if (v instanceof Boolean b)
            return b;
        if (v instanceof Number n)
            return n.doubleValue() != 0;
        String s = v.toString().trim();
        return s.equalsIgnoreCase("true") || s.equals("1");
    }
}
