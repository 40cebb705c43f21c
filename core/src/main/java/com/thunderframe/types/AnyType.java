package com.thunderframe.types;

/**
 * The erased element type reported by heterogeneous columns.
 *
 * <p>This type serves as the fallback when a column cannot be represented by one
 * of the primitive variants, for example:
 * <ul>
 *   <li>the value column produced by melting columns of different types</li>
 *   <li>a join key column whose two sides disagree on type</li>
 *   <li>a column built by a producer that does not declare a type</li>
 * </ul>
 *
 * <p>Operators never pick AnyType for a column whose values share one of the
 * primitive types.
 */
public final class AnyType implements DataType {

    private static final AnyType INSTANCE = new AnyType();

    private AnyType() {}

    public static AnyType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "any";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof AnyType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }

    // ==================== Factory Methods ====================

    /**
     * Returns the primitive data type whose value class matches the given value,
     * or AnyType when there is none.
     *
     * <p>Integral boxes narrower than {@code Long} map to LongType and
     * {@code Float} maps to DoubleType.
     *
     * @param value a non-null value
     * @return the matching data type
     */
    public static DataType typeOf(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return DoubleType.get();
        }
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return LongType.get();
        }
        if (value instanceof String) {
            return StringType.get();
        }
        if (value instanceof Boolean) {
            return BooleanType.get();
        }
        return INSTANCE;
    }
}
