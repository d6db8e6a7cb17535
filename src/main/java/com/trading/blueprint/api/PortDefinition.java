package com.trading.blueprint.api;

/**
 * Immutable declaration of one port of a node variant.
 *
 * @param name         unique per node and direction
 * @param dataType     type checked on connect
 * @param direction    input or output
 * @param label        display label, the name when blank
 * @param defaultValue literal used when an input is left unconnected, may be
 *                     {@code null}
 * @param required     inputs only; an unmet required input fails validation
 * @param multiConnect inputs only; outputs always fan out
 */
public record PortDefinition(String name, DataType dataType, PortDirection direction, String label,
        Object defaultValue, boolean required, boolean multiConnect) {

    public PortDefinition {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Port name must not be blank");
        if (dataType == null || direction == null)
            throw new IllegalArgumentException("Port '" + name + "' needs a data type and a direction");
        if (label == null || label.isBlank())
            label = name;
        if (direction == PortDirection.OUTPUT) {
            required = false;
            multiConnect = true;
        }
    }

    public static PortDefinition input(String name, DataType type, String label) {
        return new PortDefinition(name, type, PortDirection.INPUT, label, null, true, false);
    }

    /** An input that falls back to {@code defaultValue} when nothing is wired in. */
    public static PortDefinition optionalInput(String name, DataType type, String label, Object defaultValue) {
        return new PortDefinition(name, type, PortDirection.INPUT, label, defaultValue, false, false);
    }

    public static PortDefinition output(String name, DataType type, String label) {
        return new PortDefinition(name, type, PortDirection.OUTPUT, label, null, false, true);
    }

    public boolean isInput() {
        return direction == PortDirection.INPUT;
    }
}
