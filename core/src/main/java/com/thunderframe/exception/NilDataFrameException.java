package com.thunderframe.exception;

/**
 * Thrown when an operator is handed a null DataFrame.
 */
public class NilDataFrameException extends DataFrameException {

    public NilDataFrameException(String message) {
        super(message);
    }
}
