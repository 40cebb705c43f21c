package com.thunderframe.ops;

import com.thunderframe.exception.ColumnNotFoundException;
import com.thunderframe.exception.InvalidMergeKindException;
import com.thunderframe.exception.NilDataFrameException;
import com.thunderframe.frame.DataFrame;
import com.thunderframe.series.AnySeries;
import com.thunderframe.series.DoubleSeries;
import com.thunderframe.series.LongSeries;
import com.thunderframe.series.StringSeries;
import com.thunderframe.test.TestBase;
import com.thunderframe.test.TestCategories;
import com.thunderframe.types.LongType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Merge Tests")
public class MergeTest extends TestBase {

    private DataFrame people;
    private DataFrame ages;

    @Override
    protected void doSetUp() {
        people = DataFrame.builder()
            .column("ID", LongSeries.of(1, 2, 3))
            .column("Name", StringSeries.of("Alice", "Bob", "Charlie"))
            .build();
        ages = DataFrame.builder()
            .column("ID", LongSeries.of(1, 2))
            .column("Age", LongSeries.of(25, 30))
            .build();
    }

    @Nested
    @DisplayName("Join kinds")
    class JoinKinds {

        @Test
        @DisplayName("Left merge keeps unmatched left rows with null right columns")
        void testLeftMerge() {
            DataFrame result = Merge.merge(people, ages, "ID", JoinType.LEFT);

            assertThat(result.columnOrder()).containsExactly("ID", "Name", "Age");
            assertThat(result.length()).isEqualTo(3);
            assertThat(result.column("ID").toList()).containsExactly(1L, 2L, 3L);
            assertThat(result.column("Name").toList()).containsExactly("Alice", "Bob", "Charlie");
            assertThat(result.column("Age").toList()).containsExactly(25L, 30L, null);
            assertThat(result.index()).containsExactly("0", "1", "2");
        }

        @Test
        @DisplayName("Inner merge keeps matched rows only")
        void testInnerMerge() {
            DataFrame result = people.merge(ages, "ID", JoinType.INNER);

            assertThat(result.length()).isEqualTo(2);
            assertThat(result.column("Name").toList()).containsExactly("Alice", "Bob");
        }

        @Test
        @DisplayName("Right merge fills the key from the right side")
        void testRightMerge() {
            DataFrame right = DataFrame.builder()
                .column("ID", LongSeries.of(3, 4))
                .column("Age", LongSeries.of(40, 50))
                .build();

            DataFrame result = Merge.merge(people, right, "ID", "right");

            assertThat(result.column("ID").toList()).containsExactly(3L, 4L);
            assertThat(result.column("Name").toList()).containsExactly("Charlie", null);
            assertThat(result.column("Age").toList()).containsExactly(40L, 50L);
            assertThat(result.column("ID").dataType()).isEqualTo(LongType.get());
        }

        @Test
        @DisplayName("Full merge appends unmatched right rows after the left output")
        void testFullMerge() {
            DataFrame right = DataFrame.builder()
                .column("ID", LongSeries.ofNullable(2L, 5L, null))
                .column("Age", LongSeries.of(30, 50, 60))
                .build();

            DataFrame result = Merge.merge(people, right, "ID", JoinType.FULL);

            assertThat(result.column("ID").toList()).containsExactly(1L, 2L, 3L, 5L, null);
            assertThat(result.column("Name").toList()).containsExactly("Alice", "Bob", "Charlie", null, null);
            assertThat(result.column("Age").toList()).containsExactly(null, 30L, null, 50L, 60L);
        }

        @ParameterizedTest(name = "\"{0}\" parses to {1}")
        @CsvSource({
            "inner, INNER",
            "LEFT, LEFT",
            "Right, RIGHT",
            "full, FULL"
        })
        @DisplayName("Merge kinds parse case-insensitively")
        void testParse(String text, JoinType expected) {
            assertThat(JoinType.parse(text)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Cardinality")
    class Cardinality {

        private DataFrame left;
        private DataFrame right;

        private void build() {
            left = DataFrame.builder()
                .column("k", StringSeries.of("a", "a", "b", null, "c"))
                .column("l", LongSeries.of(1, 2, 3, 4, 5))
                .build();
            right = DataFrame.builder()
                .column("k", StringSeries.of("a", "a", "a", "b", null, "d"))
                .column("r", LongSeries.of(10, 20, 30, 40, 50, 60))
                .build();
        }

        @Test
        @DisplayName("Inner size is the sum over shared keys of the count products")
        void testInnerCardinality() {
            build();
            // a: 2 * 3, b: 1 * 1; null keys never match
            assertThat(Merge.merge(left, right, "k", JoinType.INNER).length()).isEqualTo(7);
        }

        @Test
        @DisplayName("Left merge fans out matches and keeps unmatched rows once")
        void testLeftCoverage() {
            build();
            DataFrame result = Merge.merge(left, right, "k", JoinType.LEFT);

            // 6 + 1 matched rows, plus the null-keyed and "c" left rows once each
            assertThat(result.length()).isEqualTo(9);
            assertThat(result.column("l").toList()).containsExactly(1L, 1L, 1L, 2L, 2L, 2L, 3L, 4L, 5L);
        }

        @Test
        @DisplayName("Full size is the left size plus unmatched right rows")
        void testFullCompleteness() {
            build();
            int leftSize = Merge.merge(left, right, "k", JoinType.LEFT).length();
            DataFrame full = Merge.merge(left, right, "k", JoinType.FULL);

            // unmatched right rows: the null key and "d"
            assertThat(full.length()).isEqualTo(leftSize + 2);
            assertThat(full.column("r").toList().subList(leftSize, leftSize + 2)).containsExactly(50L, 60L);
        }

        @Test
        @DisplayName("Right merge fans out over left matches in right order")
        void testRightFanOut() {
            build();
            DataFrame result = Merge.merge(left, right, "k", JoinType.RIGHT);

            // three "a" rows x two left matches, one "b", plus null and "d" once
            assertThat(result.length()).isEqualTo(9);
            assertThat(result.column("k").toList()).endsWith("b", null, "d");
        }
    }

    @Nested
    @DisplayName("Columns and typing")
    class ColumnsAndTyping {

        @Test
        @DisplayName("Colliding non-key columns get suffixes")
        void testSuffixes() {
            DataFrame left = DataFrame.builder()
                .column("id", LongSeries.of(1))
                .column("v", StringSeries.of("L"))
                .build();
            DataFrame right = DataFrame.builder()
                .column("id", LongSeries.of(1))
                .column("v", StringSeries.of("R"))
                .build();

            DataFrame result = Merge.merge(left, right, "id", JoinType.INNER);
            assertThat(result.columnOrder()).containsExactly("id", "v_x", "v_y");

            DataFrame custom = Merge.merge(left, right, "id", "id", JoinType.INNER,
                MergeOptions.builder().leftSuffix("_left").rightSuffix("_right").build());
            assertThat(custom.columnOrder()).containsExactly("id", "v_left", "v_right");
        }

        @Test
        @DisplayName("Different key names keep the left name")
        void testDifferentKeyNames() {
            DataFrame right = DataFrame.builder()
                .column("person", LongSeries.of(2))
                .column("Age", LongSeries.of(30))
                .build();

            DataFrame result = Merge.merge(people, right, "ID", "person", JoinType.INNER, MergeOptions.defaults());

            assertThat(result.columnOrder()).containsExactly("ID", "Name", "Age");
            assertThat(result.get(0, "Name")).isEqualTo("Bob");
        }

        @Test
        @DisplayName("A right key of another type turns the key column mixed")
        void testKeyTypeFallback() {
            DataFrame right = DataFrame.builder()
                .column("ID", StringSeries.of("x"))
                .column("Age", LongSeries.of(1))
                .build();

            DataFrame result = Merge.merge(people, right, "ID", JoinType.FULL);

            assertThat(result.column("ID")).isInstanceOf(AnySeries.class);
            assertThat(result.column("ID").toList()).containsExactly(1L, 2L, 3L, "x");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Missing frames, keys and kinds are rejected")
        void testValidation() {
            assertThatThrownBy(() -> Merge.merge(null, ages, "ID", JoinType.LEFT))
                .isInstanceOf(NilDataFrameException.class);
            assertThatThrownBy(() -> Merge.merge(people, null, "ID", JoinType.LEFT))
                .isInstanceOf(NilDataFrameException.class);
            assertThatThrownBy(() -> Merge.merge(people, ages, "Name", JoinType.LEFT))
                .isInstanceOf(ColumnNotFoundException.class)
                .hasMessageContaining("right DataFrame");
            assertThatThrownBy(() -> Merge.merge(people, ages, "ID", "sideways"))
                .isInstanceOf(InvalidMergeKindException.class)
                .satisfies(e -> assertThat(((InvalidMergeKindException) e).getKind()).isEqualTo("sideways"));
        }

        @Test
        @DisplayName("A missing frame is reported before an unknown kind")
        void testMissingFrameBeforeKind() {
            assertThatThrownBy(() -> Merge.merge(null, ages, "ID", "sideways"))
                .isInstanceOf(NilDataFrameException.class);
            assertThatThrownBy(() -> Merge.merge(people, null, "ID", "sideways"))
                .isInstanceOf(NilDataFrameException.class);
        }
    }

    @Nested
    @DisplayName("Floating point keys")
    class FloatingPointKeys {

        @Test
        @DisplayName("Negative zero matches positive zero")
        void testSignedZero() {
            DataFrame left = DataFrame.builder()
                .column("k", DoubleSeries.of(0.0))
                .column("a", LongSeries.of(1))
                .build();
            DataFrame right = DataFrame.builder()
                .column("k", DoubleSeries.of(-0.0))
                .column("b", LongSeries.of(2))
                .build();

            DataFrame result = Merge.merge(left, right, "k", JoinType.INNER);

            assertThat(result.length()).isEqualTo(1);
            assertThat(result.get(0, "b")).isEqualTo(2L);
        }

        @Test
        @DisplayName("NaN keys never match")
        void testNaN() {
            DataFrame left = DataFrame.builder()
                .column("k", DoubleSeries.of(Double.NaN, 1.0))
                .column("a", LongSeries.of(1, 2))
                .build();
            DataFrame right = DataFrame.builder()
                .column("k", DoubleSeries.of(Double.NaN, 1.0))
                .column("b", LongSeries.of(10, 20))
                .build();

            assertThat(Merge.merge(left, right, "k", JoinType.INNER).column("b").toList())
                .containsExactly(20L);

            DataFrame full = Merge.merge(left, right, "k", JoinType.FULL);
            assertThat(full.length()).isEqualTo(3);
            assertThat(full.column("b").toList()).containsExactly(null, 20L, 10L);
        }
    }
}
