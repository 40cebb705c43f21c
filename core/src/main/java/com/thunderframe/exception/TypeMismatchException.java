package com.thunderframe.exception;

/**
 * Thrown when a value's runtime class does not match a Series' element type.
 *
 * <p>The Series is left unchanged.
 */
public class TypeMismatchException extends DataFrameException {

    private final String expected;
    private final String got;

    /**
     * Creates a type mismatch exception.
     *
     * @param expected the element type the Series enforces
     * @param got the class name of the rejected value
     */
    public TypeMismatchException(String expected, String got) {
        super(String.format("type mismatch: expected %s, got %s", expected, got));
        this.expected = expected;
        this.got = got;
    }

    public String getExpected() {
        return expected;
    }

    public String getGot() {
        return got;
    }
}
