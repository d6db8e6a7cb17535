package com.trading.blueprint.api;

/** Value kinds a node parameter can hold. */
public enum ParameterKind {
    INT,
    FLOAT,
    BOOL,
    STRING
}
