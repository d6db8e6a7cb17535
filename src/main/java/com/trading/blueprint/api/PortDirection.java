package com.trading.blueprint.api;

public enum PortDirection {
    INPUT,
    OUTPUT;

    public PortDirection opposite() {
        return this == INPUT ? OUTPUT : INPUT;
    }
}
