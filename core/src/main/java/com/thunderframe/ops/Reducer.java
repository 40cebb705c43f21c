package com.thunderframe.ops;

import com.thunderframe.types.AnyType;
import com.thunderframe.types.DataType;

import java.util.List;

/**
 * Reduces the values of one column within one group to a single value.
 *
 * <p>The values list holds the group's cells in row order, nulls included.
 * A reducer may throw {@link com.thunderframe.exception.NonNumericValueException};
 * the group-by engine then records a null for that cell and carries on.
 */
@FunctionalInterface
public interface Reducer {

    Object reduce(List<Object> values);

    /**
     * Returns the type of the reduced values. {@link AnyType} means the output
     * column type is inferred from the results.
     *
     * @return the result type
     */
    default DataType resultType() {
        return AnyType.get();
    }
}
