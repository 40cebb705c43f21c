package com.thunderframe.frame;

import com.thunderframe.exception.LabelNotFoundException;
import com.thunderframe.series.Series;

import java.util.Arrays;
import java.util.List;

/**
 * Label-based access to a DataFrame's rows and columns.
 *
 * <p>When the index holds a label more than once, the first occurrence wins.
 */
public final class LocIndexer {

    private final DataFrame frame;

    LocIndexer(DataFrame frame) {
        this.frame = frame;
    }

    /**
     * Returns the value at a row label and column name.
     *
     * @param label the row label
     * @param column the column name
     * @return the value, or null for a null cell
     * @throws LabelNotFoundException if the label is not in the index
     * @throws com.thunderframe.exception.ColumnNotFoundException if the column does not exist
     */
    public Object at(String label, String column) {
        Series series = frame.column(column);
        return series.get(position(frame.index(), label));
    }

    public DataFrame row(String label) {
        return rows(label);
    }

    public DataFrame rows(String... labels) {
        List<String> index = frame.index();
        int[] positions = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            positions[i] = position(index, labels[i]);
        }
        return frame.take(positions);
    }

    public Series col(String name) {
        return frame.column(name);
    }

    public DataFrame cols(String... names) {
        return frame.select(Arrays.asList(names));
    }

    private static int position(List<String> index, String label) {
        int pos = index.indexOf(label);
        if (pos < 0) {
            throw new LabelNotFoundException(label);
        }
        return pos;
    }
}
