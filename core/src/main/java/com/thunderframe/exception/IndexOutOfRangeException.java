package com.thunderframe.exception;

/**
 * Thrown when a position lies outside {@code [0, length)}.
 */
public class IndexOutOfRangeException extends DataFrameException {

    private final int index;
    private final int length;

    public IndexOutOfRangeException(int index, int length) {
        super(String.format("index %d out of range for length %d", index, length));
        this.index = index;
        this.length = length;
    }

    public int getIndex() {
        return index;
    }

    public int getLength() {
        return length;
    }
}
