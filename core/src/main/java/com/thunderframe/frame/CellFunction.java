package com.thunderframe.frame;

/**
 * Maps one non-null cell to its replacement in {@link DataFrame#applyInPlace}.
 */
@FunctionalInterface
public interface CellFunction {

    /**
     * @param value the current value, never null
     * @param row the row position
     * @param column the column name
     * @return the new value; null makes the cell null
     */
    Object apply(Object value, int row, String column);
}
