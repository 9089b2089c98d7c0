package com.livemux.stats;

import com.livemux.query.Request;
import com.livemux.query.RequestParser;
import com.livemux.schema.SchemaRegistry;
import com.livemux.schema.Table;
import com.livemux.store.QueryScope;
import com.livemux.store.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for stats accumulation and merging of partial results.
 */
@DisplayName("Stats Tests")
class StatsAccumulatorTest {

    private final SchemaRegistry schema = new SchemaRegistry();
    private final RequestParser parser = new RequestParser(schema);
    private final QueryScope scope = new QueryScope("p1", "Site 1", name -> null);

    private Row host(String name, long state, double latency) {
        Table hosts = schema.getTable("hosts");
        Object[] values = new Object[hosts.getStoredColumns().size()];
        values[hosts.getColumn("name").getIndex()] = name;
        values[hosts.getColumn("state").getIndex()] = state;
        values[hosts.getColumn("latency").getIndex()] = latency;
        return new Row(values);
    }

    // ========== Accumulator ==========

    @Test
    @DisplayName("Should keep sum, count, min and max of numeric values")
    void shouldReduceNumbers() {
        // Given
        Request request = parser.parse("GET hosts\nStats: avg latency\nStats: min latency\nStats: max latency\n"
                + "Stats: sum latency\n");
        List<StatsAccumulator> accumulators = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            accumulators.add(new StatsAccumulator(request.getStats().get(i)));
        }

        // When
        for (Object value : List.of(2L, 0.5, "ignored", 4.5)) {
            for (StatsAccumulator accumulator : accumulators) {
                accumulator.add(value);
            }
        }

        // Then
        assertThat(accumulators.get(0).result()).isEqualTo(7.0 / 3);
        assertThat(accumulators.get(1).result()).isEqualTo(0.5);
        assertThat(accumulators.get(2).result()).isEqualTo(4.5);
        assertThat(accumulators.get(3).result()).isEqualTo(7.0);
        assertThat(accumulators.get(0).getCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should report zero when nothing was accumulated")
    void shouldReportZeroForEmptyInput() {
        Request request = parser.parse("GET hosts\nStats: avg latency\nStats: state = 0\n");

        assertThat(new StatsAccumulator(request.getStats().get(0)).result()).isEqualTo(0.0);
        assertThat(new StatsAccumulator(request.getStats().get(1)).result()).isEqualTo(0L);
    }

    @Test
    @DisplayName("Should recombine averages from merged sums and counts")
    void shouldMergeAverages() {
        // Given
        Request request = parser.parse("GET hosts\nStats: avg latency\n");
        StatsAccumulator first = new StatsAccumulator(request.getStats().get(0));
        StatsAccumulator second = new StatsAccumulator(request.getStats().get(0));
        first.add(1.0);
        second.add(2.0);
        second.add(3.0);
        second.add(4.0);

        // When
        first.merge(second);

        // Then
        assertThat((Double) first.result()).isCloseTo(2.5, within(1e-9));
        assertThat(first.getCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should not let empty partials disturb min and max")
    void shouldIgnoreEmptyPartialsForMinMax() {
        Request request = parser.parse("GET hosts\nStats: min latency\n");
        StatsAccumulator empty = new StatsAccumulator(request.getStats().get(0));
        StatsAccumulator filled = new StatsAccumulator(request.getStats().get(0));
        filled.add(3.0);

        empty.merge(filled);
        filled.merge(new StatsAccumulator(request.getStats().get(0)));

        assertThat(empty.result()).isEqualTo(3.0);
        assertThat(filled.result()).isEqualTo(3.0);
    }

    // ========== Engine ==========

    @Test
    @DisplayName("Should count matching rows per Stats entry")
    void shouldCountMatchingRows() {
        Request request = parser.parse("GET hosts\nStats: state = 0\nStats: state = 1\nStats: state != 9\n");
        List<Row> rows = List.of(host("a", 0, 0.1), host("b", 1, 0.2), host("c", 0, 0.3));

        StatsResult result = StatsEngine.accumulate(request, rows, scope);

        assertThat(result.toRows()).containsExactly(List.of(2L, 1L, 3L));
    }

    @Test
    @DisplayName("Should always produce one row for ungrouped stats")
    void shouldProduceSingleRowWithoutMatches() {
        Request request = parser.parse("GET hosts\nStats: state = 0\nStats: sum latency\n");

        StatsResult result = StatsEngine.accumulate(request, List.of(), scope);

        assertThat(result.toRows()).containsExactly(List.of(0L, 0.0));
    }

    @Test
    @DisplayName("Should group by the requested columns in first-seen order")
    void shouldGroupRows() {
        Request request = parser.parse("GET hosts\nColumns: state\nStats: sum latency\n");
        List<Row> rows = List.of(host("a", 1, 1.0), host("b", 0, 2.0), host("c", 1, 3.0));

        StatsResult result = StatsEngine.accumulate(request, rows, scope);

        assertThat(result.getGroupCount()).isEqualTo(2);
        assertThat(result.toRows()).containsExactly(List.of(1L, 4.0), List.of(0L, 2.0));
    }

    @Test
    @DisplayName("Should union groups when merging partial results")
    void shouldMergeGroupedResults() {
        // Given
        Request request = parser.parse("GET hosts\nColumns: state\nStats: avg latency\nStats: state >= 0\n");
        StatsResult first = StatsEngine.accumulate(request,
                List.of(host("a", 0, 1.0), host("b", 1, 5.0)), scope);
        StatsResult second = StatsEngine.accumulate(request,
                List.of(host("c", 2, 4.0), host("d", 0, 3.0)), scope);

        // When
        StatsResult merged = new StatsResult(request.getStats(), true);
        merged.merge(first);
        merged.merge(second);

        // Then
        assertThat(merged.toRows()).containsExactly(
                List.of(0L, 2.0, 2L),
                List.of(1L, 5.0, 1L),
                List.of(2L, 4.0, 1L));
    }
}
