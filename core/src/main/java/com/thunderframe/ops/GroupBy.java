package com.thunderframe.ops;

import com.thunderframe.exception.ColumnNotFoundException;
import com.thunderframe.exception.NonNumericValueException;
import com.thunderframe.frame.DataFrame;
import com.thunderframe.series.Series;
import com.thunderframe.types.AnyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Rows of a DataFrame partitioned by the values of one or more columns.
 *
 * <p>A group key renders each by-column value with {@link String#valueOf} and
 * joins the parts with {@link #KEY_SEPARATOR}. A null part renders as
 * {@link #NULL_KEY}, which sorts before any other rendering. Groups are always
 * visited in ascending key order.
 *
 * <p>The partition is computed once, when the GroupBy is created. Later writes
 * to the source frame change the values read by aggregations but not the
 * group membership.
 */
public final class GroupBy {

    private static final Logger logger = LoggerFactory.getLogger(GroupBy.class);

    /** Separator between the parts of a multi-column key */
    public static final String KEY_SEPARATOR = "\u001F";

    /** Rendering of a null key part */
    public static final String NULL_KEY = "\u0000null";

    private final DataFrame source;
    private final List<String> by;
    private final TreeMap<String, int[]> groups;

    private GroupBy(DataFrame source, List<String> by, TreeMap<String, int[]> groups) {
        this.source = source;
        this.by = by;
        this.groups = groups;
    }

    /**
     * Groups a DataFrame by the given columns.
     *
     * @param df the source frame
     * @param by the grouping columns
     * @return the grouping
     * @throws ColumnNotFoundException if a grouping column does not exist
     * @throws IllegalArgumentException if no grouping column is given
     */
    public static GroupBy of(DataFrame df, String... by) {
        return of(df, Arrays.asList(by));
    }

    public static GroupBy of(DataFrame df, List<String> by) {
        Objects.requireNonNull(df, "df must not be null");
        Objects.requireNonNull(by, "by must not be null");
        if (by.isEmpty()) {
            throw new IllegalArgumentException("at least one grouping column is required");
        }
        Map<String, Series> columns = df.columns();
        for (String name : by) {
            if (!columns.containsKey(name)) {
                throw new ColumnNotFoundException(name);
            }
        }

        int rows = df.length();
        Map<String, List<Integer>> staging = new HashMap<>();
        for (int row = 0; row < rows; row++) {
            staging.computeIfAbsent(keyOf(columns, by, row), k -> new ArrayList<>()).add(row);
        }
        TreeMap<String, int[]> groups = new TreeMap<>();
        for (Map.Entry<String, List<Integer>> entry : staging.entrySet()) {
            groups.put(entry.getKey(), entry.getValue().stream().mapToInt(Integer::intValue).toArray());
        }

        logger.debug("Grouped {} rows by {} into {} groups", rows, by, groups.size());
        return new GroupBy(df, List.copyOf(by), groups);
    }

    private static String keyOf(Map<String, Series> columns, List<String> by, int row) {
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < by.size(); i++) {
            if (i > 0) {
                key.append(KEY_SEPARATOR);
            }
            Object value = columns.get(by.get(i)).get(row);
            key.append(value == null ? NULL_KEY : String.valueOf(value));
        }
        return key.toString();
    }

    public int groupCount() {
        return groups.size();
    }

    /**
     * Returns the group keys in ascending order.
     *
     * @return an unmodifiable list of keys
     */
    public List<String> groupKeys() {
        return Collections.unmodifiableList(new ArrayList<>(groups.keySet()));
    }

    /**
     * Returns a copy of one group's rows, keeping their labels.
     *
     * @param key a key from {@link #groupKeys()}
     * @return a new DataFrame
     * @throws IllegalArgumentException if there is no such group
     */
    public DataFrame group(String key) {
        int[] rows = groups.get(key);
        if (rows == null) {
            throw new IllegalArgumentException("no group with key '" + key + "'");
        }
        return source.take(rows);
    }

    /**
     * Reduces every non-grouping column per group.
     *
     * <p>The output has one row per group in key order: the grouping columns,
     * holding each group's first-row values in their source type, followed by
     * the reduced columns in source column order. A cell whose reduction fails
     * with {@link NonNumericValueException} is null.
     *
     * @param reducer the reduction
     * @return a new DataFrame indexed {@code "0".."g-1"}
     */
    public DataFrame aggregate(Reducer reducer) {
        Objects.requireNonNull(reducer, "reducer must not be null");
        Map<String, Series> columns = source.columns();
        Set<String> byColumns = new HashSet<>(by);
        int count = groups.size();

        Map<String, Series> out = new HashMap<>();
        List<String> order = new ArrayList<>();

        for (String name : by) {
            Series column = columns.get(name);
            ColumnBuffer buffer = new ColumnBuffer(name, column.dataType(), count);
            for (int[] rows : groups.values()) {
                buffer.add(column.get(rows[0]));
            }
            out.put(name, buffer.build());
            order.add(name);
        }

        int failures = 0;
        for (Map.Entry<String, Series> entry : columns.entrySet()) {
            String name = entry.getKey();
            if (byColumns.contains(name)) {
                continue;
            }
            Series column = entry.getValue();
            ColumnBuffer buffer = reducer.resultType() instanceof AnyType
                ? ColumnBuffer.inferring(name, count)
                : new ColumnBuffer(name, reducer.resultType(), count);
            for (Map.Entry<String, int[]> group : groups.entrySet()) {
                List<Object> values = new ArrayList<>(group.getValue().length);
                for (int row : group.getValue()) {
                    values.add(column.get(row));
                }
                try {
                    buffer.add(reducer.reduce(values));
                } catch (NonNumericValueException e) {
                    failures++;
                    logger.debug("Column '{}' group '{}': {}", name, group.getKey(), e.getMessage());
                    buffer.add(null);
                }
            }
            out.put(name, buffer.build());
            order.add(name);
        }
        if (failures > 0) {
            logger.warn("{} aggregate cells set to null because of non-numeric values", failures);
        }

        return new DataFrame(out, order, null);
    }

    public DataFrame sum() {
        return aggregate(Aggregation.SUM);
    }

    public DataFrame mean() {
        return aggregate(Aggregation.MEAN);
    }

    public DataFrame min() {
        return aggregate(Aggregation.MIN);
    }

    public DataFrame max() {
        return aggregate(Aggregation.MAX);
    }

    public DataFrame count() {
        return aggregate(Aggregation.COUNT);
    }

    /**
     * Applies a function to each group and concatenates the results along rows.
     *
     * <p>Each call receives its own deep copy of the group's rows with their
     * original labels. Null results are skipped. The output index is the
     * concatenation of the results' indexes.
     *
     * @param fn the per-group function
     * @return the concatenated results, or an empty DataFrame if there are none
     */
    public DataFrame apply(Function<DataFrame, DataFrame> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        List<DataFrame> results = new ArrayList<>();
        for (int[] rows : groups.values()) {
            DataFrame result = fn.apply(source.take(rows));
            if (result != null) {
                results.add(result);
            }
        }
        if (results.isEmpty()) {
            return new DataFrame();
        }
        return Concat.concat(results, ConcatOptions.defaults());
    }
}
