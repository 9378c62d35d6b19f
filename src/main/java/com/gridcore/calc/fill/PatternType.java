package com.gridcore.calc.fill;

/**
 * Extrapolation rule applied by a fill.
 */
public interface PatternType {

    /** Arithmetic progression. */
    record Linear(double slope) implements PatternType {
    }

    /** Geometric progression. */
    record Exponential(double rate) implements PatternType {
    }

    /** Calendar dates a fixed number of days apart. */
    record Date(long incrementDays) implements PatternType {
    }

    /** Text with an embedded counter, e.g. {@code Item 1, Item 2}. */
    record Text() implements PatternType {
    }

    /** A host-defined sequence; values repeat like {@link Copy}. */
    record Custom(String name) implements PatternType {
    }

    /** Repeats the source values in order. */
    record Copy() implements PatternType {
    }
}
