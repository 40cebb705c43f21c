package com.thunderframe.ops;

import java.util.Objects;

/**
 * Options for {@link Concat}.
 */
public final class ConcatOptions {

    /** Direction of concatenation */
    public enum Axis {
        /** Stack rows, aligning columns by name */
        ROWS,
        /** Place columns side by side, aligning rows by label */
        COLUMNS
    }

    /** How the non-concatenation axis is combined */
    public enum Join {
        /** Union, missing cells null */
        OUTER,
        /** Intersection */
        INNER
    }

    private final Axis axis;
    private final Join join;
    private final boolean ignoreIndex;
    private final boolean verifyIntegrity;
    private final boolean sort;

    private ConcatOptions(Builder builder) {
        this.axis = builder.axis;
        this.join = builder.join;
        this.ignoreIndex = builder.ignoreIndex;
        this.verifyIntegrity = builder.verifyIntegrity;
        this.sort = builder.sort;
    }

    public static ConcatOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Axis axis() {
        return axis;
    }

    public Join join() {
        return join;
    }

    /** Whether the output rows are relabelled {@code "0".."n-1"} */
    public boolean ignoreIndex() {
        return ignoreIndex;
    }

    /** Whether duplicate row labels in a row concatenation are rejected */
    public boolean verifyIntegrity() {
        return verifyIntegrity;
    }

    /** Whether the non-concatenation axis is sorted */
    public boolean sort() {
        return sort;
    }

    public static final class Builder {
        private Axis axis = Axis.ROWS;
        private Join join = Join.OUTER;
        private boolean ignoreIndex;
        private boolean verifyIntegrity;
        private boolean sort;

        private Builder() {}

        public Builder axis(Axis axis) {
            this.axis = Objects.requireNonNull(axis, "axis must not be null");
            return this;
        }

        public Builder join(Join join) {
            this.join = Objects.requireNonNull(join, "join must not be null");
            return this;
        }

        public Builder ignoreIndex(boolean ignoreIndex) {
            this.ignoreIndex = ignoreIndex;
            return this;
        }

        public Builder verifyIntegrity(boolean verifyIntegrity) {
            this.verifyIntegrity = verifyIntegrity;
            return this;
        }

        public Builder sort(boolean sort) {
            this.sort = sort;
            return this;
        }

        public ConcatOptions build() {
            return new ConcatOptions(this);
        }
    }
}
