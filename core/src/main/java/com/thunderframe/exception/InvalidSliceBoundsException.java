package com.thunderframe.exception;

/**
 * Thrown unless {@code 0 <= start <= end <= length}.
 */
public class InvalidSliceBoundsException extends DataFrameException {

    private final int start;
    private final int end;
    private final int length;

    public InvalidSliceBoundsException(int start, int end, int length) {
        super(String.format("invalid slice bounds [%d, %d) for length %d", start, end, length));
        this.start = start;
        this.end = end;
        this.length = length;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getLength() {
        return length;
    }
}
