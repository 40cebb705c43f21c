package com.thunderframe.interchange;

import com.thunderframe.frame.DataFrame;
import com.thunderframe.series.Series;
import com.thunderframe.types.AnyType;
import com.thunderframe.types.BooleanType;
import com.thunderframe.types.DataType;
import com.thunderframe.types.DoubleType;
import com.thunderframe.types.LongType;
import com.thunderframe.types.StringType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conversion between DataFrames and Arrow {@link VectorSchemaRoot}s.
 *
 * <p>Type mapping:
 * <pre>
 *   Arrow                         Series
 *   Bit                    <->    BooleanSeries
 *   TinyInt/SmallInt/Int   ->     LongSeries
 *   BigInt                 <->    LongSeries
 *   Float4                 ->     DoubleSeries
 *   Float8                 <->    DoubleSeries
 *   VarChar                <->    StringSeries
 *   anything else          ->     mixed AnySeries (via getObject)
 *   VarChar                <-     AnySeries (String.valueOf of each value)
 * </pre>
 * The Arrow validity bitmap maps to the null mask in both directions.
 *
 * <p>Example usage:
 * <pre>
 *   try (BufferAllocator allocator = new RootAllocator();
 *        VectorSchemaRoot root = ArrowInterchange.toVectorSchemaRoot(df, allocator)) {
 *       DataFrame back = ArrowInterchange.toDataFrame(root);
 *   }
 * </pre>
 */
public class ArrowInterchange {

    private static final Logger logger = LoggerFactory.getLogger(ArrowInterchange.class);

    private ArrowInterchange() {} // Utility class

    /**
     * Copies an Arrow root into a new DataFrame indexed {@code "0".."n-1"}.
     *
     * @param root the Arrow data; not closed by this method
     * @return a new DataFrame
     */
    public static DataFrame toDataFrame(VectorSchemaRoot root) {
        Objects.requireNonNull(root, "root must not be null");
        int rows = root.getRowCount();

        Map<String, Series> columns = new HashMap<>();
        List<String> order = new ArrayList<>();
        for (FieldVector vector : root.getFieldVectors()) {
            String name = vector.getField().getName();
            if (columns.containsKey(name)) {
                throw new IllegalArgumentException("duplicate Arrow field '" + name + "'");
            }
            Series series = Series.ofType(seriesType(vector), rows);
            for (int row = 0; row < rows; row++) {
                series.append(getVectorValue(vector, row));
            }
            columns.put(name, series);
            order.add(name);
        }

        logger.debug("Imported Arrow root: {} rows, {} columns", rows, order.size());
        return new DataFrame(columns, order, null);
    }

    /**
     * Copies a DataFrame into a new Arrow root. Row labels are not exported.
     *
     * @param df the DataFrame
     * @param allocator allocator for the vectors
     * @return a new root owned by the caller, who must close it
     */
    public static VectorSchemaRoot toVectorSchemaRoot(DataFrame df, BufferAllocator allocator) {
        Objects.requireNonNull(df, "df must not be null");
        Objects.requireNonNull(allocator, "allocator must not be null");

        Map<String, DataType> dtypes = df.dtypes();
        int rows = df.length();

        List<Field> fields = new ArrayList<>(dtypes.size());
        for (Map.Entry<String, DataType> entry : dtypes.entrySet()) {
            fields.add(new Field(entry.getKey(), FieldType.nullable(arrowType(entry.getValue())), null));
        }

        VectorSchemaRoot root = VectorSchemaRoot.create(new Schema(fields), allocator);
        try {
            for (String name : dtypes.keySet()) {
                Series series = df.column(name);
                FieldVector vector = root.getVector(name);
                vector.allocateNew();
                for (int row = 0; row < rows; row++) {
                    setVectorValue(vector, row, series.get(row));
                }
                vector.setValueCount(rows);
            }
            root.setRowCount(rows);
        } catch (RuntimeException e) {
            root.close();
            throw e;
        }

        logger.debug("Exported DataFrame to Arrow: {} rows, {} columns", rows, fields.size());
        return root;
    }

    private static DataType seriesType(FieldVector vector) {
        if (vector instanceof BitVector) {
            return BooleanType.get();
        } else if (vector instanceof TinyIntVector || vector instanceof SmallIntVector
                || vector instanceof IntVector || vector instanceof BigIntVector) {
            return LongType.get();
        } else if (vector instanceof Float4Vector || vector instanceof Float8Vector) {
            return DoubleType.get();
        } else if (vector instanceof VarCharVector) {
            return StringType.get();
        }
        return AnyType.get();
    }

    /**
     * Gets a value from an Arrow vector, widened to the Series element class.
     *
     * @param vector the vector to read from
     * @param index the row index
     * @return the value (may be null)
     */
    private static Object getVectorValue(FieldVector vector, int index) {
        if (vector.isNull(index)) {
            return null;
        }

        if (vector instanceof BitVector) {
            return ((BitVector) vector).get(index) != 0;
        } else if (vector instanceof TinyIntVector) {
            return (long) ((TinyIntVector) vector).get(index);
        } else if (vector instanceof SmallIntVector) {
            return (long) ((SmallIntVector) vector).get(index);
        } else if (vector instanceof IntVector) {
            return (long) ((IntVector) vector).get(index);
        } else if (vector instanceof BigIntVector) {
            return ((BigIntVector) vector).get(index);
        } else if (vector instanceof Float4Vector) {
            return (double) ((Float4Vector) vector).get(index);
        } else if (vector instanceof Float8Vector) {
            return ((Float8Vector) vector).get(index);
        } else if (vector instanceof VarCharVector) {
            byte[] bytes = ((VarCharVector) vector).get(index);
            return new String(bytes, StandardCharsets.UTF_8);
        }

        return vector.getObject(index);
    }

    private static ArrowType arrowType(DataType type) {
        if (type instanceof BooleanType) {
            return ArrowType.Bool.INSTANCE;
        } else if (type instanceof LongType) {
            return new ArrowType.Int(64, true);
        } else if (type instanceof DoubleType) {
            return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
        }
        // Strings and mixed values
        return ArrowType.Utf8.INSTANCE;
    }

    private static void setVectorValue(FieldVector vector, int index, Object value) {
        if (value == null) {
            if (vector instanceof BitVector) {
                ((BitVector) vector).setNull(index);
            } else if (vector instanceof BigIntVector) {
                ((BigIntVector) vector).setNull(index);
            } else if (vector instanceof Float8Vector) {
                ((Float8Vector) vector).setNull(index);
            } else {
                ((VarCharVector) vector).setNull(index);
            }
            return;
        }

        if (vector instanceof BitVector) {
            ((BitVector) vector).setSafe(index, (Boolean) value ? 1 : 0);
        } else if (vector instanceof BigIntVector) {
            ((BigIntVector) vector).setSafe(index, ((Number) value).longValue());
        } else if (vector instanceof Float8Vector) {
            ((Float8Vector) vector).setSafe(index, ((Number) value).doubleValue());
        } else {
            ((VarCharVector) vector).setSafe(index, String.valueOf(value).getBytes(StandardCharsets.UTF_8));
        }
    }
}
