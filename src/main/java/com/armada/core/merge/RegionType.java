package com.armada.core.merge;

public enum RegionType {
    IMPORTS,
    CLASS,
    INTERFACE,
    FUNCTION,
    TYPE_DEFINITION,
    CONSTANT,
    /** Fixed-size chunk or unnamed changed lines. */
    OTHER
}
