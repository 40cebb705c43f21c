package com.thunderframe.ops;

import com.thunderframe.exception.ColumnNotFoundException;
import com.thunderframe.frame.DataFrame;
import com.thunderframe.series.Series;
import com.thunderframe.types.StringType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Unpivots a DataFrame from wide to long format.
 *
 * <p>The output is row-major: for every source row, one output row per value
 * column, holding the id values, the value column's name and its cell. Nulls
 * propagate unchanged.
 */
public final class Melt {

    private static final Logger logger = LoggerFactory.getLogger(Melt.class);

    private Melt() {} // Utility class

    /**
     * Melts a DataFrame.
     *
     * @param df the source frame
     * @param options id columns, value columns and output names
     * @return a new DataFrame with {@code df.length() * valueVars} rows
     * @throws ColumnNotFoundException if an id or value column does not exist
     * @throws IllegalArgumentException if there are no value columns, or an
     *         output name collides with an id column
     */
    public static DataFrame melt(DataFrame df, MeltOptions options) {
        Objects.requireNonNull(df, "df must not be null");
        Objects.requireNonNull(options, "options must not be null");

        Map<String, Series> columns = df.columns();
        for (String name : options.idVars()) {
            if (!columns.containsKey(name)) {
                throw new ColumnNotFoundException(name);
            }
        }
        for (String name : options.valueVars()) {
            if (!columns.containsKey(name)) {
                throw new ColumnNotFoundException(name);
            }
        }

        List<String> valueVars = options.valueVars();
        if (valueVars.isEmpty()) {
            Set<String> ids = new HashSet<>(options.idVars());
            valueVars = new ArrayList<>();
            for (String name : columns.keySet()) {
                if (!ids.contains(name)) {
                    valueVars.add(name);
                }
            }
        }
        if (valueVars.isEmpty()) {
            throw new IllegalArgumentException("melt needs at least one value column");
        }
        if (options.idVars().contains(options.varName()) || options.idVars().contains(options.valueName())
                || options.varName().equals(options.valueName())) {
            throw new IllegalArgumentException(String.format(
                "melt output names '%s'/'%s' collide with id columns %s",
                options.varName(), options.valueName(), options.idVars()));
        }

        int rows = df.length();
        int outRows = rows * valueVars.size();

        List<Series> valueSeries = new ArrayList<>(valueVars.size());
        for (String name : valueVars) {
            valueSeries.add(columns.get(name));
        }

        Map<String, Series> out = new HashMap<>();
        List<String> order = new ArrayList<>();

        for (String id : options.idVars()) {
            Series source = columns.get(id);
            ColumnBuffer buffer = new ColumnBuffer(id, source.dataType(), outRows);
            for (int row = 0; row < rows; row++) {
                Object value = source.get(row);
                for (int v = 0; v < valueVars.size(); v++) {
                    buffer.add(value);
                }
            }
            out.put(id, buffer.build());
            order.add(id);
        }

        ColumnBuffer variables = new ColumnBuffer(options.varName(), StringType.get(), outRows);
        ColumnBuffer values = new ColumnBuffer(options.valueName(), ColumnBuffer.commonType(valueSeries), outRows);
        for (int row = 0; row < rows; row++) {
            for (int v = 0; v < valueVars.size(); v++) {
                variables.add(valueVars.get(v));
                values.add(valueSeries.get(v).get(row));
            }
        }
        out.put(options.varName(), variables.build());
        order.add(options.varName());
        out.put(options.valueName(), values.build());
        order.add(options.valueName());

        logger.debug("Melted {} rows x {} value columns -> {} rows", rows, valueVars.size(), outRows);
        return new DataFrame(out, order, null);
    }
}
