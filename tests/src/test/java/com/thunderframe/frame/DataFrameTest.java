package com.thunderframe.frame;

import com.thunderframe.exception.ColumnNotFoundException;
import com.thunderframe.exception.IndexOutOfRangeException;
import com.thunderframe.exception.LengthMismatchException;
import com.thunderframe.exception.TypeMismatchException;
import com.thunderframe.series.AnySeries;
import com.thunderframe.series.DoubleSeries;
import com.thunderframe.series.LongSeries;
import com.thunderframe.series.Series;
import com.thunderframe.series.StringSeries;
import com.thunderframe.test.TestBase;
import com.thunderframe.test.TestCategories;
import com.thunderframe.types.AnyType;
import com.thunderframe.types.DoubleType;
import com.thunderframe.types.LongType;
import com.thunderframe.types.StringType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("DataFrame Tests")
public class DataFrameTest extends TestBase {

    private DataFrame people;

    @Override
    protected void doSetUp() {
        people = DataFrame.builder()
            .column("id", LongSeries.of(1, 2, 3))
            .column("name", StringSeries.of("Alice", "Bob", null))
            .column("score", DoubleSeries.ofNullable(9.5, null, 7.0))
            .build();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Default index is 0..n-1")
        void testDefaultIndex() {
            assertThat(people.length()).isEqualTo(3);
            assertThat(people.columnCount()).isEqualTo(3);
            assertThat(people.index()).containsExactly("0", "1", "2");
            assertThat(people.columnOrder()).containsExactly("id", "name", "score");
        }

        @Test
        @DisplayName("Columns of different lengths are rejected")
        void testColumnLengthMismatch() {
            assertThatThrownBy(() -> DataFrame.builder()
                    .column("a", LongSeries.of(1, 2))
                    .column("b", LongSeries.of(1))
                    .build())
                .isInstanceOf(LengthMismatchException.class);
        }

        @Test
        @DisplayName("An index of the wrong length is rejected")
        void testIndexLengthMismatch() {
            assertThatThrownBy(() -> DataFrame.builder()
                    .column("a", LongSeries.of(1, 2))
                    .index("x")
                    .build())
                .isInstanceOf(LengthMismatchException.class);
        }

        @Test
        @DisplayName("Column order must be a permutation of the column names")
        void testColumnOrderValidation() {
            Map<String, Series> columns = new HashMap<>();
            columns.put("a", LongSeries.of(1));
            assertThatThrownBy(() -> new DataFrame(columns, List.of("a", "b"), null))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new DataFrame(columns, List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("An empty DataFrame has no rows and no columns")
        void testEmpty() {
            DataFrame empty = new DataFrame();
            assertThat(empty.length()).isZero();
            assertThat(empty.columnCount()).isZero();
            assertThat(empty.dtypes()).isEmpty();
        }

        @Test
        @DisplayName("dtypes lists columns in order with their types")
        void testDtypes() {
            assertThat(people.dtypes()).containsExactly(
                entry("id", LongType.get()),
                entry("name", StringType.get()),
                entry("score", DoubleType.get()));
        }
    }

    @Nested
    @DisplayName("Select and column")
    class Select {

        @Test
        @DisplayName("select returns a view sharing Series with the source")
        void testSelectAliases() {
            DataFrame view = people.select("score", "id");

            assertThat(view.columnOrder()).containsExactly("score", "id");
            assertThat(view.column("id")).isSameAs(people.column("id"));

            view.set(0, "id", 42L);
            assertThat(people.get(0, "id")).isEqualTo(42L);
        }

        @Test
        @DisplayName("select copies the index")
        void testSelectCopiesIndex() {
            DataFrame view = people.select("id");
            view.setIndex(List.of("a", "b", "c"));
            assertThat(people.index()).containsExactly("0", "1", "2");
        }

        @Test
        @DisplayName("select fails when any name is missing")
        void testSelectMissing() {
            assertThatThrownBy(() -> people.select("id", "missing"))
                .isInstanceOf(ColumnNotFoundException.class)
                .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("column fails for an unknown name")
        void testColumnMissing() {
            assertThatThrownBy(() -> people.column("nope"))
                .isInstanceOf(ColumnNotFoundException.class)
                .satisfies(e -> assertThat(((ColumnNotFoundException) e).getColumn()).isEqualTo("nope"));
        }
    }

    @Nested
    @DisplayName("Rename and index")
    class RenameAndIndex {

        @Test
        @DisplayName("rename keeps column positions")
        void testRename() {
            people.rename(Map.of("name", "full_name"));

            assertThat(people.columnOrder()).containsExactly("id", "full_name", "score");
            assertThat(people.get(0, "full_name")).isEqualTo("Alice");
            assertThat(people.hasColumn("name")).isFalse();
        }

        @Test
        @DisplayName("rename with an unknown column leaves the frame untouched")
        void testRenameAtomic() {
            Map<String, String> renames = new HashMap<>();
            renames.put("id", "key");
            renames.put("ghost", "g");

            assertThatThrownBy(() -> people.rename(renames))
                .isInstanceOf(ColumnNotFoundException.class);
            assertThat(people.columnOrder()).containsExactly("id", "name", "score");
        }

        @Test
        @DisplayName("rename rejects an empty map and duplicate results")
        void testRenameInvalid() {
            assertThatThrownBy(() -> people.rename(Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> people.rename(Map.of("id", "name")))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(people.columnOrder()).containsExactly("id", "name", "score");
        }

        @Test
        @DisplayName("rename can swap two names")
        void testRenameSwap() {
            people.rename(Map.of("id", "name", "name", "id"));
            assertThat(people.columnOrder()).containsExactly("name", "id", "score");
            assertThat(people.get(0, "name")).isEqualTo(1L);
        }

        @Test
        @DisplayName("setIndex validates length and resetIndex restores the default")
        void testIndex() {
            people.setIndex(List.of("a", "b", "c"));
            assertThat(people.index()).containsExactly("a", "b", "c");

            assertThatThrownBy(() -> people.setIndex(List.of("a")))
                .isInstanceOf(LengthMismatchException.class);

            people.resetIndex();
            assertThat(people.index()).containsExactly("0", "1", "2");
        }
    }

    @Nested
    @DisplayName("Row operations")
    class RowOperations {

        @Test
        @DisplayName("addColumn appends and validates")
        void testAddColumn() {
            people.addColumn("flag", StringSeries.of("x", "y", "z"));
            assertThat(people.columnOrder()).endsWith("flag");

            assertThatThrownBy(() -> people.addColumn("flag", StringSeries.of("a", "b", "c")))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> people.addColumn("short", StringSeries.of("a")))
                .isInstanceOf(LengthMismatchException.class);
        }

        @Test
        @DisplayName("isNA reports null cells")
        void testIsNA() {
            assertThat(people.isNA(2, "name")).isTrue();
            assertThat(people.isNA(0, "name")).isFalse();
            assertThatThrownBy(() -> people.isNA(3, "name"))
                .isInstanceOf(IndexOutOfRangeException.class);
        }

        @Test
        @DisplayName("copy is deep")
        void testCopy() {
            DataFrame copy = people.copy();
            copy.set(0, "name", "Zed");
            assertThat(people.get(0, "name")).isEqualTo("Alice");
        }

        @Test
        @DisplayName("take keeps labels of the taken rows")
        void testTake() {
            people.setIndex(List.of("a", "b", "c"));
            DataFrame taken = people.take(new int[] {2, 0});

            assertThat(taken.index()).containsExactly("c", "a");
            assertThat(taken.get(0, "id")).isEqualTo(3L);
        }

        @Test
        @DisplayName("head clamps to the row count")
        void testHead() {
            assertThat(people.head(2).length()).isEqualTo(2);
            assertThat(people.head(10).length()).isEqualTo(3);
            DataFrame none = people.head(0);
            assertThat(none.length()).isZero();
            assertThat(none.columnOrder()).containsExactly("id", "name", "score");
        }

        @Test
        @DisplayName("fillNA fills only columns whose type accepts the value")
        void testFillNA() {
            DataFrame filled = people.fillNA("unknown");

            assertThat(filled.get(2, "name")).isEqualTo("unknown");
            assertThat(filled.isNA(1, "score")).isTrue();
            assertThat(people.isNA(2, "name")).isTrue();
        }

        @Test
        @DisplayName("dropNA removes rows with any null")
        void testDropNA() {
            DataFrame dropped = people.dropNA();

            assertThat(dropped.length()).isEqualTo(1);
            assertThat(dropped.index()).containsExactly("0");
            assertThat(dropped.get(0, "name")).isEqualTo("Alice");
        }
    }

    @Nested
    @DisplayName("Apply")
    class Apply {

        @Test
        @DisplayName("Column-wise apply returns one result per column")
        void testApplyColumns() {
            Series nulls = people.apply(series -> (long) series.nullCount(), LongType.get());

            assertThat(nulls.dataType()).isEqualTo(LongType.get());
            assertThat(nulls.toList()).containsExactly(0L, 1L, 1L);
        }

        @Test
        @DisplayName("Column-wise apply without a type infers it from the results")
        void testApplyColumnsInferred() {
            Series types = people.apply(series -> series.dataType().typeName());

            assertThat(types.dataType()).isEqualTo(StringType.get());
            assertThat(types.toList()).containsExactly("long", "string", "double");
        }

        @Test
        @DisplayName("Row-wise apply sees each row's values in column order, nulls included")
        void testApplyRows() {
            Series rendered = people.applyRows(row -> row.toString(), StringType.get());

            assertThat(rendered.toList()).containsExactly(
                "[1, Alice, 9.5]", "[2, Bob, null]", "[3, null, 7.0]");
        }

        @Test
        @DisplayName("Row-wise apply into a mixed Series accepts any result")
        void testApplyRowsMixed() {
            Series firsts = people.applyRows(row -> row.get(1) == null ? row.get(0) : row.get(1),
                AnyType.get());

            assertThat(firsts).isInstanceOf(AnySeries.class);
            assertThat(firsts.toList()).containsExactly("Alice", "Bob", 3L);
        }

        @Test
        @DisplayName("A result the Series type rejects fails")
        void testApplyTypeMismatch() {
            assertThatThrownBy(() -> people.apply(series -> "x", LongType.get()))
                .isInstanceOf(TypeMismatchException.class);
            assertThatThrownBy(() -> people.applyRows(row -> row.get(0), StringType.get()))
                .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("applyInPlace rewrites non-null cells and skips nulls")
        void testApplyInPlace() {
            List<String> visited = new ArrayList<>();
            people.applyInPlace((value, row, column) -> {
                visited.add(row + ":" + column);
                if (value instanceof Long l) {
                    return l * 10;
                }
                if (value instanceof Double d) {
                    return d * 2;
                }
                return value.toString().toUpperCase();
            });

            assertThat(people.column("id").toList()).containsExactly(10L, 20L, 30L);
            assertThat(people.column("name").toList()).containsExactly("ALICE", "BOB", null);
            assertThat(people.column("score").toList()).containsExactly(19.0, null, 14.0);
            assertThat(visited).containsExactly(
                "0:id", "0:name", "0:score", "1:id", "1:name", "2:id", "2:score");
        }

        @Test
        @DisplayName("applyInPlace leaves the frame unchanged when a result is rejected")
        void testApplyInPlaceAtomic() {
            assertThatThrownBy(() -> people.applyInPlace(
                    (value, row, column) -> column.equals("score") && row == 2 ? "bad" : value))
                .isInstanceOf(TypeMismatchException.class);

            assertThat(people.column("id").toList()).containsExactly(1L, 2L, 3L);
            assertThat(people.column("score").toList()).containsExactly(9.5, null, 7.0);
        }

        @Test
        @DisplayName("applyInPlace writes through to select views")
        void testApplyInPlaceSharedSeries() {
            DataFrame view = people.select("id");
            people.applyInPlace((value, row, column) -> column.equals("id") ? (Long) value + 1 : value);

            assertThat(view.column("id").toList()).containsExactly(2L, 3L, 4L);
        }
    }
}
