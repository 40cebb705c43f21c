package com.thunderframe.ops;

import com.thunderframe.config.FrameConfig;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Options for {@link Pivot#pivotTable}.
 *
 * <p>{@code indexColumns} become the row keys, the distinct values of
 * {@code columnsColumn} become output columns, and {@code valueColumns} are
 * aggregated per cell. The aggregation defaults to
 * {@link FrameConfig#pivotAggregation()}; cells without values stay null
 * unless a fill value is set.
 */
public final class PivotTableOptions {

    private final List<String> indexColumns;
    private final String columnsColumn;
    private final List<String> valueColumns;
    private final Aggregation aggregation;
    private final Object fillValue;

    private PivotTableOptions(Builder builder) {
        this.indexColumns = builder.indexColumns;
        this.columnsColumn = builder.columnsColumn;
        this.valueColumns = builder.valueColumns;
        this.aggregation = builder.aggregation != null ? builder.aggregation : FrameConfig.pivotAggregation();
        this.fillValue = builder.fillValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> indexColumns() {
        return indexColumns;
    }

    public String columnsColumn() {
        return columnsColumn;
    }

    public List<String> valueColumns() {
        return valueColumns;
    }

    public Aggregation aggregation() {
        return aggregation;
    }

    /**
     * Returns the value written to cells with no values, or null.
     */
    public Object fillValue() {
        return fillValue;
    }

    public static final class Builder {
        private List<String> indexColumns = List.of();
        private String columnsColumn;
        private List<String> valueColumns = List.of();
        private Aggregation aggregation;
        private Object fillValue;

        private Builder() {}

        public Builder index(String... columns) {
            this.indexColumns = List.copyOf(Arrays.asList(columns));
            return this;
        }

        public Builder columns(String column) {
            this.columnsColumn = column;
            return this;
        }

        public Builder values(String... columns) {
            this.valueColumns = List.copyOf(Arrays.asList(columns));
            return this;
        }

        public Builder aggregation(Aggregation aggregation) {
            this.aggregation = Objects.requireNonNull(aggregation, "aggregation must not be null");
            return this;
        }

        public Builder fillValue(Object fillValue) {
            this.fillValue = fillValue;
            return this;
        }

        public PivotTableOptions build() {
            return new PivotTableOptions(this);
        }
    }
}
