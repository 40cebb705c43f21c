package com.thunderframe.ops;

import com.thunderframe.exception.TypeMismatchException;
import com.thunderframe.series.AnySeries;
import com.thunderframe.series.Series;
import com.thunderframe.types.AnyType;
import com.thunderframe.types.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Stages the values of one output column and materializes them into a Series.
 *
 * <p>The target type is a preference: if a staged value does not fit it, the
 * column is built as a mixed {@link AnySeries} instead. A buffer created with
 * {@link #inferring} has no target and picks its type from the staged values.
 */
final class ColumnBuffer {

    private static final Logger logger = LoggerFactory.getLogger(ColumnBuffer.class);

    private final String name;
    private final DataType type;
    private final List<Object> values;

    ColumnBuffer(String name, DataType type, int capacity) {
        this.name = name;
        this.type = type;
        this.values = new ArrayList<>(capacity);
    }

    static ColumnBuffer inferring(String name, int capacity) {
        return new ColumnBuffer(name, null, capacity);
    }

    void add(Object value) {
        values.add(value);
    }

    int size() {
        return values.size();
    }

    Series build() {
        if (type == null) {
            return Series.infer(values);
        }
        Series series = Series.ofType(type, values.size());
        try {
            for (Object value : values) {
                series.append(value);
            }
            return series;
        } catch (TypeMismatchException e) {
            logger.warn("Column '{}' falls back to mixed values: {}", name, e.getMessage());
            AnySeries mixed = AnySeries.mixed(values.size());
            for (Object value : values) {
                mixed.append(value);
            }
            return mixed;
        }
    }

    /**
     * Returns the type shared by all series, or {@link AnyType} if they disagree.
     */
    static DataType commonType(List<Series> series) {
        DataType common = null;
        for (Series s : series) {
            if (common == null) {
                common = s.dataType();
            } else if (!common.equals(s.dataType())) {
                return AnyType.get();
            }
        }
        return common == null ? AnyType.get() : common;
    }
}
