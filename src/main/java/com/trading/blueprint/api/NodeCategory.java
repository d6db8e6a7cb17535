package com.trading.blueprint.api;

/**
 * Palette categories. Declaration order is the order editors list them in.
 */
public enum NodeCategory {
    DATA("data", "Data"),
    INDICATOR("indicator", "Indicators"),
    SIGNAL("signal", "Signals"),
    LOGIC("logic", "Logic"),
    TRADE("trade", "Trade"),
    PARAM("param", "Parameters");

    private final String tag;
    private final String title;

    NodeCategory(String tag, String title) {
        this.tag = tag;
        this.title = title;
    }

    /** Lower-case tag, also the prefix of every type tag in the category. */
    public String tag() {
        return tag;
    }

    public String title() {
        return title;
    }
}
