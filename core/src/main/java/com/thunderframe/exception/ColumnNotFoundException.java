package com.thunderframe.exception;

/**
 * Thrown when an operation references a column the DataFrame does not have.
 */
public class ColumnNotFoundException extends DataFrameException {

    private final String column;

    public ColumnNotFoundException(String column) {
        super("column '" + column + "' not found");
        this.column = column;
    }

    public ColumnNotFoundException(String column, String side) {
        super("column '" + column + "' not found in " + side + " DataFrame");
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
