package com.thunderframe.ops;

import com.thunderframe.exception.ColumnNotFoundException;
import com.thunderframe.frame.DataFrame;
import com.thunderframe.series.Series;
import com.thunderframe.types.AnyType;
import com.thunderframe.types.DataType;
import com.thunderframe.types.DoubleType;
import com.thunderframe.types.LongType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Spreadsheet-style pivot tables.
 *
 * <p>Rows are the distinct index tuples and columns the distinct renderings of
 * the columns column, both in ascending order, so the result does not depend
 * on the source row order. Rows whose columns value is null are left out of
 * every cell. Only numeric values are aggregated; other values are skipped,
 * and a value column whose declared type is not numeric contributes nothing.
 */
public final class Pivot {

    private static final Logger logger = LoggerFactory.getLogger(Pivot.class);

    private Pivot() {} // Utility class

    /**
     * Builds a pivot table.
     *
     * @param df the source frame
     * @param options index, columns, values, aggregation and fill value
     * @return a new DataFrame: the index columns followed by one column per
     *         (value column, columns value) pair
     * @throws IllegalArgumentException if index, columns or values are not specified,
     *         or a generated column name collides with an index column or another
     *         generated name
     * @throws ColumnNotFoundException if a referenced column does not exist
     */
    public static DataFrame pivotTable(DataFrame df, PivotTableOptions options) {
        Objects.requireNonNull(df, "df must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (options.indexColumns().isEmpty()) {
            throw new IllegalArgumentException("pivot index column(s) must be specified");
        }
        if (options.columnsColumn() == null || options.columnsColumn().isEmpty()) {
            throw new IllegalArgumentException("pivot columns column must be specified");
        }
        if (options.valueColumns().isEmpty()) {
            throw new IllegalArgumentException("pivot value column(s) must be specified");
        }

        Map<String, Series> columns = df.columns();
        List<String> referenced = new ArrayList<>(options.indexColumns());
        referenced.add(options.columnsColumn());
        referenced.addAll(options.valueColumns());
        for (String name : referenced) {
            if (!columns.containsKey(name)) {
                throw new ColumnNotFoundException(name);
            }
        }

        List<String> aggregated = new ArrayList<>();
        for (String valueColumn : options.valueColumns()) {
            DataType type = columns.get(valueColumn).dataType();
            if (type.isNumeric() || type instanceof AnyType) {
                aggregated.add(valueColumn);
            } else {
                logger.warn("Pivot value column '{}' has non-numeric type {}, its cells stay empty",
                    valueColumn, type.typeName());
            }
        }

        Series pivotColumn = columns.get(options.columnsColumn());
        int rows = df.length();

        TreeSet<String> columnValues = new TreeSet<>();
        TreeMap<String, Integer> indexRows = new TreeMap<>();
        // index key -> columns value -> value column -> values
        Map<String, Map<String, Map<String, List<Object>>>> cells = new HashMap<>();
        int skipped = 0;

        for (int row = 0; row < rows; row++) {
            String indexKey = indexKey(columns, options.indexColumns(), row);
            indexRows.putIfAbsent(indexKey, row);

            Object pivotValue = pivotColumn.get(row);
            if (pivotValue == null) {
                continue;
            }
            String columnValue = String.valueOf(pivotValue);
            columnValues.add(columnValue);

            Map<String, List<Object>> cell = cells
                .computeIfAbsent(indexKey, k -> new HashMap<>())
                .computeIfAbsent(columnValue, k -> new HashMap<>());
            for (String valueColumn : aggregated) {
                Object value = columns.get(valueColumn).get(row);
                if (value instanceof Number) {
                    cell.computeIfAbsent(valueColumn, k -> new ArrayList<>()).add(value);
                } else if (value != null) {
                    skipped++;
                }
            }
        }
        if (skipped > 0) {
            logger.warn("Pivot skipped {} non-numeric values", skipped);
        }

        boolean single = options.valueColumns().size() == 1;
        checkNames(options.indexColumns(), options.valueColumns(), columnValues, single);

        int outRows = indexRows.size();
        Map<String, Series> out = new HashMap<>();
        List<String> order = new ArrayList<>();

        for (String name : options.indexColumns()) {
            Series source = columns.get(name);
            ColumnBuffer buffer = new ColumnBuffer(name, source.dataType(), outRows);
            for (int row : indexRows.values()) {
                buffer.add(source.get(row));
            }
            out.put(name, buffer.build());
            order.add(name);
        }

        Aggregation aggregation = options.aggregation();
        Object fill = fillFor(options.fillValue(), aggregation.resultType());

        for (String valueColumn : options.valueColumns()) {
            for (String columnValue : columnValues) {
                String name = pivotName(valueColumn, columnValue, single);
                ColumnBuffer buffer = new ColumnBuffer(name, aggregation.resultType(), outRows);
                for (String indexKey : indexRows.keySet()) {
                    List<Object> values = cells
                        .getOrDefault(indexKey, Map.of())
                        .getOrDefault(columnValue, Map.of())
                        .get(valueColumn);
                    buffer.add(values == null || values.isEmpty() ? fill : aggregation.reduce(values));
                }
                out.put(name, buffer.build());
                order.add(name);
            }
        }

        logger.debug("Pivoted {} rows into {} x {} ({})", rows, outRows, columnValues.size(), aggregation);
        return new DataFrame(out, order, null);
    }

    private static String pivotName(String valueColumn, String columnValue, boolean single) {
        return single ? columnValue : valueColumn + "_" + columnValue;
    }

    private static void checkNames(List<String> indexColumns, List<String> valueColumns,
                                   Set<String> columnValues, boolean single) {
        Set<String> names = new HashSet<>(indexColumns);
        for (String valueColumn : valueColumns) {
            for (String columnValue : columnValues) {
                String name = pivotName(valueColumn, columnValue, single);
                if (!names.add(name)) {
                    throw new IllegalArgumentException(indexColumns.contains(name)
                        ? "pivot column '" + name + "' collides with index column '" + name + "'"
                        : "pivot produces duplicate column '" + name + "'");
                }
            }
        }
    }

    private static String indexKey(Map<String, Series> columns, List<String> indexColumns, int row) {
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < indexColumns.size(); i++) {
            if (i > 0) {
                key.append(GroupBy.KEY_SEPARATOR);
            }
            Object value = columns.get(indexColumns.get(i)).get(row);
            key.append(value == null ? GroupBy.NULL_KEY : String.valueOf(value));
        }
        return key.toString();
    }

    /**
     * Widens a numeric fill value to the aggregation's result type.
     */
    private static Object fillFor(Object fillValue, DataType resultType) {
        if (fillValue instanceof Number number) {
            if (resultType instanceof DoubleType) {
                return number.doubleValue();
            }
            if (resultType instanceof LongType) {
                return number.longValue();
            }
        }
        return fillValue;
    }
}
