package com.thunderframe.exception;

/**
 * Base class for all errors raised by Series, DataFrame and the operators.
 *
 * <p>Every fallible operation in thunderframe throws a subclass of this
 * exception. Structural validation happens before any mutation or output
 * construction, so a thrown DataFrameException never leaves a partially
 * modified frame or a partial result behind.
 *
 * <p>Subclasses:
 * <ul>
 *   <li>{@link IndexOutOfRangeException} - positional access outside a Series</li>
 *   <li>{@link TypeMismatchException} - a value of the wrong class written to a typed Series</li>
 *   <li>{@link LengthMismatchException} - data/mask or column lengths disagree</li>
 *   <li>{@link ColumnNotFoundException} - a referenced column does not exist</li>
 *   <li>{@link LabelNotFoundException} - a referenced row label does not exist</li>
 *   <li>{@link NilDataFrameException} - an operator received no DataFrame</li>
 *   <li>{@link InvalidMergeKindException} - an unknown join kind</li>
 *   <li>{@link InvalidSliceBoundsException} - slice bounds outside the Series</li>
 *   <li>{@link NonNumericValueException} - a numeric reduction met a non-numeric value</li>
 * </ul>
 */
public class DataFrameException extends RuntimeException {

    public DataFrameException(String message) {
        super(message);
    }

    public DataFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
