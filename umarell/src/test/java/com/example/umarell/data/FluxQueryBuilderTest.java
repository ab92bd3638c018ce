package com.example.umarell.data;

import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FluxQueryBuilderTest {

    private final FluxQueryBuilder builder =
            new FluxQueryBuilder("building", "sensor_id", null, null, ReadingSelector.LAST);

    @Test
    void batchesAllSensorsIntoOneQuery() {
        FluxQuery q = builder.batch(List.of("sensor_002_co2", "sensor_003_co2", "sensor_101_co2"), "-1h");

        assertThat(q.flux()).isEqualTo("""
                from(bucket: "building")
                  |> range(start: -1h)
                  |> filter(fn: (r) => r["sensor_id"] =~ /^(?:sensor_002_co2|sensor_003_co2|sensor_101_co2)$/)
                  |> group(columns: ["sensor_id", "_field"])
                  |> sort(columns: ["_time"])
                  |> last()""");
        assertThat(q.sensorIds()).containsExactly("sensor_002_co2", "sensor_003_co2", "sensor_101_co2");
        assertThat(q.timeRange()).isEqualTo("-1h");
    }

    @Test
    void fieldsOfOneSensorStayInSeparateTables() {
        var custom = new FluxQueryBuilder("b", "device", null, null, ReadingSelector.MEAN);

        FluxQuery q = custom.batch(List.of("s1"), "-1h");

        assertThat(q.flux())
                .contains("  |> group(columns: [\"device\", \"_field\"])\n")
                .endsWith("  |> mean()");
    }

    @Test
    void duplicateIdsAreQueriedOnce() {
        FluxQuery q = builder.batch(List.of("a", "b", "a"), "2h");

        assertThat(q.sensorIds()).containsExactly("a", "b");
        assertThat(q.flux()).contains("/^(?:a|b)$/").contains("range(start: -2h)");
    }

    @Test
    void sensorIdsAreMatchedLiterally() {
        FluxQuery q = builder.batch(List.of("co2.room(1)", "t/1"), "-1h");

        assertThat(q.flux()).contains("/^(?:co2\\.room\\(1\\)|t\\/1)$/");
    }

    @Test
    void meanSelectorAndOptionalFilters() {
        var mean = new FluxQueryBuilder("b", "sensor_id", "environment", "value", ReadingSelector.MEAN);

        FluxQuery q = mean.batch(List.of("s1"), "-24h");

        assertThat(q.flux())
                .contains("  |> filter(fn: (r) => r[\"_measurement\"] == \"environment\")\n")
                .contains("  |> filter(fn: (r) => r[\"_field\"] == \"value\")\n")
                .endsWith("  |> mean()")
                .doesNotContain("last()");
    }

    @Test
    void badTimeRangeIsInvalidInput() {
        assertThatThrownBy(() -> builder.batch(List.of("s1"), "-1h) |> drop(columns: [\"_value\"]"))
                .isInstanceOf(InspectorException.class)
                .extracting(e -> ((InspectorException) e).getKind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
    }

    @Test
    void emptyBatchIsAProgrammingError() {
        assertThatThrownBy(() -> builder.batch(List.of(), "-1h"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void selectorParsing() {
        assertThat(ReadingSelector.parse(null)).isEqualTo(ReadingSelector.LAST);
        assertThat(ReadingSelector.parse(" Mean ")).isEqualTo(ReadingSelector.MEAN);
    }
}
