package io.renderscratch.core;

/**
 * Enumeration of scratch value shapes.
 */
public enum ScratchValueType {
    NUMERIC,
    TEXT,
    SEQUENCE,
    MAPPING
}
