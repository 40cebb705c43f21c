package com.thunderframe.exception;

/**
 * Thrown when two sequences that must be parallel have different lengths.
 *
 * <p>Raised when building a Series from data and mask arrays, when assembling a
 * DataFrame whose columns or index disagree on row count, and by
 * {@code setIndex} with the wrong number of labels.
 */
public class LengthMismatchException extends DataFrameException {

    private final int dataLength;
    private final int maskLength;

    public LengthMismatchException(int dataLength, int maskLength) {
        this(String.format("length mismatch: data has %d entries, mask has %d",
            dataLength, maskLength), dataLength, maskLength);
    }

    public LengthMismatchException(String message, int dataLength, int maskLength) {
        super(message);
        this.dataLength = dataLength;
        this.maskLength = maskLength;
    }

    public int getDataLength() {
        return dataLength;
    }

    public int getMaskLength() {
        return maskLength;
    }
}
