package com.thunderframe.exception;

/**
 * Thrown by numeric reductions that meet a value they cannot coerce to a number.
 *
 * <p>Group and pivot aggregation catch this exception per cell and emit null
 * for that cell instead of failing the whole operation.
 */
public class NonNumericValueException extends DataFrameException {

    private final transient Object value;

    public NonNumericValueException(Object value) {
        super("non-numeric value: " + value + " ("
            + (value == null ? "null" : value.getClass().getSimpleName()) + ")");
        this.value = value;
    }

    public Object getValue() {
        return value;
    }
}
