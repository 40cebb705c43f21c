package com.thunderframe.ops;

import com.thunderframe.config.FrameConfig;

import java.util.Objects;

/**
 * Options for {@link Merge}.
 *
 * <p>The suffixes are appended to non-key columns whose name appears on both
 * sides. Defaults come from {@link FrameConfig}.
 */
public final class MergeOptions {

    private final String leftSuffix;
    private final String rightSuffix;

    private MergeOptions(Builder builder) {
        this.leftSuffix = builder.leftSuffix;
        this.rightSuffix = builder.rightSuffix;
        if (leftSuffix.equals(rightSuffix)) {
            throw new IllegalArgumentException("merge suffixes must differ, both are '" + leftSuffix + "'");
        }
    }

    public static MergeOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String leftSuffix() {
        return leftSuffix;
    }

    public String rightSuffix() {
        return rightSuffix;
    }

    public static final class Builder {
        private String leftSuffix = FrameConfig.leftSuffix();
        private String rightSuffix = FrameConfig.rightSuffix();

        private Builder() {}

        public Builder leftSuffix(String suffix) {
            this.leftSuffix = Objects.requireNonNull(suffix, "suffix must not be null");
            return this;
        }

        public Builder rightSuffix(String suffix) {
            this.rightSuffix = Objects.requireNonNull(suffix, "suffix must not be null");
            return this;
        }

        public MergeOptions build() {
            return new MergeOptions(this);
        }
    }
}
