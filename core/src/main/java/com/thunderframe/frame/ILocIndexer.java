package com.thunderframe.frame;

import com.thunderframe.exception.IndexOutOfRangeException;
import com.thunderframe.exception.InvalidSliceBoundsException;
import com.thunderframe.series.Series;

import java.util.ArrayList;
import java.util.List;

/**
 * Position-based access to a DataFrame's rows and columns.
 *
 * <p>Row results are deep copies keeping the original row labels. Column
 * results alias the frame's Series, like {@link DataFrame#select}.
 */
public final class ILocIndexer {

    private final DataFrame frame;

    ILocIndexer(DataFrame frame) {
        this.frame = frame;
    }

    /**
     * Returns the value at a row position and column position.
     *
     * @param row the row position
     * @param col the column position
     * @return the value, or null for a null cell
     * @throws IndexOutOfRangeException if either position is out of range
     */
    public Object at(int row, int col) {
        return col(col).get(row);
    }

    public DataFrame row(int row) {
        return rows(row);
    }

    public DataFrame rows(int... rows) {
        return frame.take(rows);
    }

    /**
     * Returns a copy of rows {@code [start, end)}.
     *
     * @throws InvalidSliceBoundsException unless {@code 0 <= start <= end <= length()}
     */
    public DataFrame range(int start, int end) {
        int length = frame.length();
        if (start < 0 || start > end || end > length) {
            throw new InvalidSliceBoundsException(start, end, length);
        }
        int[] positions = new int[end - start];
        for (int i = start; i < end; i++) {
            positions[i - start] = i;
        }
        return frame.take(positions);
    }

    public Series col(int col) {
        List<String> order = frame.columnOrder();
        if (col < 0 || col >= order.size()) {
            throw new IndexOutOfRangeException(col, order.size());
        }
        return frame.column(order.get(col));
    }

    /**
     * Returns a view over the columns at the given positions.
     *
     * @param cols column positions
     * @return a DataFrame aliasing the selected Series
     */
    public DataFrame cols(int... cols) {
        List<String> order = frame.columnOrder();
        List<String> names = new ArrayList<>(cols.length);
        for (int col : cols) {
            if (col < 0 || col >= order.size()) {
                throw new IndexOutOfRangeException(col, order.size());
            }
            names.add(order.get(col));
        }
        return frame.select(names);
    }
}
