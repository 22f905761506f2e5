package io.github.kirc.core.ssa;

/**
 * A class of physical registers a value can live in.
 */
public enum RegClass {
    /**
     * General purpose registers, holding integers, booleans and pointers.
     */
    INT,
    /**
     * Floating point (vector) registers.
     */
    FLOAT,
}
