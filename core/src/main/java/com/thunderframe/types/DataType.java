package com.thunderframe.types;

/**
 * Sealed interface for all element types in the thunderframe type system.
 *
 * <p>Every {@link com.thunderframe.series.Series} variant reports exactly one of
 * these types from {@code dataType()}. The set is closed: a column is either
 * one of the primitive variants or the erased {@link AnyType} fallback used for
 * heterogeneous columns.
 *
 * <ul>
 *   <li>Primitive types: DoubleType, LongType, StringType, BooleanType</li>
 *   <li>Erased type: AnyType</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, LongType, DoubleType, StringType, AnyType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns true when every non-null value of this type is a {@link Number}.
     * AnyType is not numeric even if the values it holds happen to be.
     *
     * @return whether the type is numeric
     */
    default boolean isNumeric() {
        return false;
    }
}
