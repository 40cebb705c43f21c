package com.thunderframe.ops;

import com.thunderframe.config.FrameConfig;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Options for {@link Melt#melt}.
 *
 * <p>An empty {@code valueVars} means every column that is not an id column.
 */
public final class MeltOptions {

    private final List<String> idVars;
    private final List<String> valueVars;
    private final String varName;
    private final String valueName;

    private MeltOptions(Builder builder) {
        this.idVars = builder.idVars;
        this.valueVars = builder.valueVars;
        this.varName = builder.varName != null ? builder.varName : FrameConfig.meltVarName();
        this.valueName = builder.valueName != null ? builder.valueName : FrameConfig.meltValueName();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> idVars() {
        return idVars;
    }

    public List<String> valueVars() {
        return valueVars;
    }

    public String varName() {
        return varName;
    }

    public String valueName() {
        return valueName;
    }

    public static final class Builder {
        private List<String> idVars = List.of();
        private List<String> valueVars = List.of();
        private String varName;
        private String valueName;

        private Builder() {}

        public Builder idVars(String... columns) {
            this.idVars = List.copyOf(Arrays.asList(columns));
            return this;
        }

        public Builder valueVars(String... columns) {
            this.valueVars = List.copyOf(Arrays.asList(columns));
            return this;
        }

        public Builder varName(String varName) {
            this.varName = Objects.requireNonNull(varName, "varName must not be null");
            return this;
        }

        public Builder valueName(String valueName) {
            this.valueName = Objects.requireNonNull(valueName, "valueName must not be null");
            return this;
        }

        public MeltOptions build() {
            return new MeltOptions(this);
        }
    }
}
