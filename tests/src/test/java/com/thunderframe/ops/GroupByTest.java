package com.thunderframe.ops;

import com.thunderframe.exception.ColumnNotFoundException;
import com.thunderframe.frame.DataFrame;
import com.thunderframe.series.DoubleSeries;
import com.thunderframe.series.LongSeries;
import com.thunderframe.series.Series;
import com.thunderframe.series.StringSeries;
import com.thunderframe.test.TestBase;
import com.thunderframe.test.TestCategories;
import com.thunderframe.types.DoubleType;
import com.thunderframe.types.LongType;
import com.thunderframe.types.StringType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("GroupBy Tests")
public class GroupByTest extends TestBase {

    private DataFrame sales;

    @Override
    protected void doSetUp() {
        sales = DataFrame.builder()
            .column("region", StringSeries.of("north", "south", "north", null, "south"))
            .column("units", LongSeries.ofNullable(10L, 5L, null, 7L, 3L))
            .column("price", DoubleSeries.ofNullable(1.5, null, 2.5, 4.0, null))
            .build();
    }

    @Nested
    @DisplayName("Aggregation")
    class AggregationTests {

        @Test
        @DisplayName("Sum groups in key order with the first-row key values")
        void testSumScenario() {
            DataFrame df = DataFrame.builder()
                .column("cat", StringSeries.of("x", "x", "y"))
                .column("val", LongSeries.of(1, 2, 3))
                .build();

            DataFrame result = GroupBy.of(df, "cat").sum();

            assertThat(result.columnOrder()).containsExactly("cat", "val");
            assertThat(result.column("cat").toList()).containsExactly("x", "y");
            assertThat(result.column("val").toList()).containsExactly(3.0, 3.0);
            assertThat(result.column("cat").dataType()).isEqualTo(StringType.get());
            assertThat(result.column("val").dataType()).isEqualTo(DoubleType.get());
            assertThat(result.index()).containsExactly("0", "1");
        }

        @Test
        @DisplayName("Null keys form their own group, sorted first")
        void testNullKeyFirst() {
            GroupBy grouped = sales.groupBy("region");

            assertThat(grouped.groupCount()).isEqualTo(3);
            assertThat(grouped.groupKeys()).containsExactly(GroupBy.NULL_KEY, "north", "south");
            assertThat(grouped.sum().column("region").toList()).containsExactly(null, "north", "south");
        }

        @Test
        @DisplayName("Sum of an all-null group is zero, mean/min/max are null")
        void testEmptyGroupAsymmetry() {
            GroupBy grouped = sales.groupBy("region");

            // south prices are all null
            assertThat(grouped.sum().column("price").toList()).containsExactly(4.0, 4.0, 0.0);
            assertThat(grouped.mean().column("price").toList()).containsExactly(4.0, 2.0, null);
            assertThat(grouped.min().column("price").toList()).containsExactly(4.0, 1.5, null);
            assertThat(grouped.max().column("price").toList()).containsExactly(4.0, 2.5, null);
        }

        @Test
        @DisplayName("Count returns non-null counts as longs")
        void testCount() {
            DataFrame counts = sales.groupBy("region").count();

            assertThat(counts.column("units").dataType()).isEqualTo(LongType.get());
            assertThat(counts.column("units").toList()).containsExactly(1L, 1L, 2L);
            assertThat(counts.column("price").toList()).containsExactly(1L, 2L, 0L);
        }

        @Test
        @DisplayName("Group sums add up to the column total")
        void testMassConservation() {
            DataFrame sums = sales.groupBy("region").sum();

            double total = 0.0;
            Series grouped = sums.column("units");
            for (int i = 0; i < grouped.length(); i++) {
                total += (Double) grouped.get(i);
            }
            assertThat(total).isEqualTo(25.0);
        }

        @Test
        @DisplayName("Non-numeric values yield null cells without failing")
        void testNonNumeric() {
            DataFrame df = DataFrame.builder()
                .column("k", StringSeries.of("a", "a", "b"))
                .column("label", StringSeries.of("p", "q", null))
                .build();

            DataFrame result = GroupBy.of(df, "k").mean();

            assertThat(result.column("label").toList()).containsExactly(null, null);
        }

        @Test
        @DisplayName("Multi-column keys join their parts with the unit separator")
        void testCompositeKey() {
            DataFrame df = DataFrame.builder()
                .column("a", StringSeries.of("x", "x", "y"))
                .column("b", LongSeries.of(2, 1, 1))
                .column("v", LongSeries.of(1, 2, 3))
                .build();

            GroupBy grouped = GroupBy.of(df, "a", "b");

            assertThat(grouped.groupKeys()).containsExactly(
                "x" + GroupBy.KEY_SEPARATOR + "1",
                "x" + GroupBy.KEY_SEPARATOR + "2",
                "y" + GroupBy.KEY_SEPARATOR + "1");
            DataFrame sums = grouped.sum();
            assertThat(sums.columnOrder()).containsExactly("a", "b", "v");
            assertThat(sums.column("b").toList()).containsExactly(1L, 2L, 1L);
            assertThat(sums.column("v").toList()).containsExactly(2.0, 1.0, 3.0);
        }

        @Test
        @DisplayName("Custom reducers infer their output type")
        void testCustomReducer() {
            DataFrame result = sales.groupBy("region").aggregate(values -> values.size());

            assertThat(result.column("units").dataType()).isEqualTo(LongType.get());
            assertThat(result.column("units").toList()).containsExactly(1L, 2L, 2L);
        }
    }

    @Nested
    @DisplayName("Groups and apply")
    class GroupsAndApply {

        @Test
        @DisplayName("group returns a copy of one group's rows with their labels")
        void testGroup() {
            DataFrame north = sales.groupBy("region").group("north");

            assertThat(north.index()).containsExactly("0", "2");
            assertThat(north.column("price").toList()).containsExactly(1.5, 2.5);
            assertThatThrownBy(() -> sales.groupBy("region").group("east"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("apply concatenates per-group results in key order")
        void testApply() {
            DataFrame firsts = sales.groupBy("region").apply(group -> group.head(1));

            assertThat(firsts.index()).containsExactly("3", "0", "1");
            assertThat(firsts.column("units").toList()).containsExactly(7L, 10L, 5L);
        }

        @Test
        @DisplayName("apply passes independent copies")
        void testApplyCopies() {
            sales.groupBy("region").apply(group -> {
                group.set(0, "units", 999L);
                return group;
            });

            assertThat(sales.column("units").toList()).containsExactly(10L, 5L, null, 7L, 3L);
        }

        @Test
        @DisplayName("apply skips null results and returns an empty frame when none remain")
        void testApplyNulls() {
            DataFrame none = sales.groupBy("region").apply(group -> null);
            assertThat(none.length()).isZero();
            assertThat(none.columnCount()).isZero();

            DataFrame some = sales.groupBy("region")
                .apply(group -> group.length() > 1 ? group.select("units") : null);
            assertThat(some.length()).isEqualTo(4);
            assertThat(some.columnOrder()).containsExactly("units");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Unknown and missing grouping columns are rejected")
        void testValidation() {
            assertThatThrownBy(() -> GroupBy.of(sales, "nope"))
                .isInstanceOf(ColumnNotFoundException.class);
            assertThatThrownBy(() -> GroupBy.of(sales, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Aggregation names parse case-insensitively")
        void testParse() {
            assertThat(Aggregation.parse("SUM")).isEqualTo(Aggregation.SUM);
            assertThat(Aggregation.parse(" mean ")).isEqualTo(Aggregation.MEAN);
            assertThatThrownBy(() -> Aggregation.parse("median"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("median");
        }
    }
}
