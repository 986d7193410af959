package com.modelauditor.core.model;

/**
 * Tag of a {@link TypedValue} variant.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    ERROR,
    EMPTY
}
