package com.trading.blueprint.api;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Port data types of the blueprint type lattice.
 *
 * <p>
 * Data types connect to themselves and to {@link #ANY}. {@link #ANY} as a
 * producer feeds every data type. {@link #EXEC} is the execution-flow type and
 * only ever pairs with another {@link #EXEC} port.
 */
public enum DataType {
    NUMBER("Number", "#58a6ff"),
    BOOLEAN("Boolean", "#f85149"),
    SERIES("Series", "#3fb950"),
    BAR("Bar", "#d29922"),
    ANY("Any", "#8b949e"),
    EXEC("Exec", "#ffffff");

    private static final Map<DataType, Set<DataType>> COMPATIBLE = new EnumMap<>(DataType.class);

    static {
        COMPATIBLE.put(NUMBER, EnumSet.of(NUMBER, ANY));
        COMPATIBLE.put(BOOLEAN, EnumSet.of(BOOLEAN, ANY));
        COMPATIBLE.put(SERIES, EnumSet.of(SERIES, ANY));
        COMPATIBLE.put(BAR, EnumSet.of(BAR, ANY));
        COMPATIBLE.put(ANY, EnumSet.of(NUMBER, BOOLEAN, SERIES, BAR, ANY));
        COMPATIBLE.put(EXEC, EnumSet.of(EXEC));
    }

    private final String displayName;
    private final String color;

    DataType(String displayName, String color) {
        this.displayName = displayName;
        this.color = color;
    }

    public String displayName() {
        return displayName;
    }

    /** Hex colour used by editors to paint ports and wires of this type. */
    public String color() {
        return color;
    }

    /** Types a port of this type may feed. */
    public Set<DataType> compatibleTargets() {
        return Collections.unmodifiableSet(COMPATIBLE.get(this));
    }

    /**
     * Whether a producer of type {@code source} may feed a consumer of type
     * {@code target}. A {@code null} on either side is incompatible.
     */
    public static boolean canConnect(DataType source, DataType target) {
        if (source == null || target == null)
            return false;
        // execution flow never mixes with data, not even through ANY
        if ((source == EXEC) != (target == EXEC))
            return false;
        if (target == ANY)
            return true;
        return source.compatibleTargets().contains(target);
    }

    public static DataType fromString(String name) {
        for (DataType t : values()) {
            if (t.name().equalsIgnoreCase(name))
                return t;
        }
        throw new IllegalArgumentException("Unknown data type: " + name);
    }
}
