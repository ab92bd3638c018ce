package com.example.umarell.data;

import com.example.umarell.security.InputSanitizer;
import com.example.umarell.security.SanitizeContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds one Flux query for any number of sensors: the ids are OR-ed into a single
 * anchored regex on the sensor tag, so N sensors never become N requests.
 */
public class FluxQueryBuilder {

    private final String bucket;
    private final String sensorTag;
    private final String measurement;
    private final String field;
    private final ReadingSelector selector;

    public FluxQueryBuilder(String bucket, String sensorTag, String measurement, String field,
                            ReadingSelector selector) {
        this.bucket = bucket;
        this.sensorTag = sensorTag;
        this.measurement = blankToNull(measurement);
        this.field = blankToNull(field);
        this.selector = selector == null ? ReadingSelector.LAST : selector;
    }

    public String getSensorTag() {
        return sensorTag;
    }

    public FluxQuery batch(Collection<String> sensorIds, String timeRange) {
        if (sensorIds == null || sensorIds.isEmpty()) {
            throw new IllegalArgumentException("at least one sensor id is required");
        }

        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(sensorIds));
        String start = InputSanitizer.sanitize(timeRange, SanitizeContext.TIME_RANGE);
        String alternation = distinct.stream()
                .map(id -> InputSanitizer.sanitize(id, SanitizeContext.REGEX_FRAGMENT))
                .collect(Collectors.joining("|"));
        String tag = str(sensorTag);

        StringBuilder flux = new StringBuilder();
        flux.append("from(bucket: \"").append(str(bucket)).append("\")\n");
        flux.append("  |> range(start: ").append(start).append(")\n");
        flux.append("  |> filter(fn: (r) => r[\"").append(tag).append("\"] =~ /^(?:")
                .append(alternation).append(")$/)\n");
        if (measurement != null) {
            flux.append("  |> filter(fn: (r) => r[\"_measurement\"] == \"").append(str(measurement)).append("\")\n");
        }
        if (field != null) {
            flux.append("  |> filter(fn: (r) => r[\"_field\"] == \"").append(str(field)).append("\")\n");
        }
        // one table per sensor and field, so last() and mean() never mix fields
        flux.append("  |> group(columns: [\"").append(tag).append("\", \"_field\"])\n");
        if (selector == ReadingSelector.MEAN) {
            flux.append("  |> mean()");
        } else {
            flux.append("  |> sort(columns: [\"_time\"])\n");
            flux.append("  |> last()");
        }

        return new FluxQuery(flux.toString(), distinct, start);
    }

    private static String str(String raw) {
        return InputSanitizer.sanitize(raw, SanitizeContext.FLUX_STRING);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
