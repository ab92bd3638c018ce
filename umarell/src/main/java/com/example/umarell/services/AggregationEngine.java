package com.example.umarell.services;

import com.example.umarell.config.SensorConfig;
import com.example.umarell.config.SensorMapping;
import com.example.umarell.config.SensorTypeSpec;
import com.example.umarell.dto.ZoneMetricsResult;
import com.example.umarell.dto.ZoneReading;
import com.example.umarell.models.Reading;
import com.example.umarell.models.SensorBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Reduces one batch of readings to the requested statistic. Sensors without a numeric
 * value in the window are counted as silent, never as zero.
 */
@Component
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    static final String VALUE_FIELD = "value";

    public record Scope(String zone, String sensorType, String timeRange, int rooms) {}

    public ZoneMetricsResult aggregate(Scope scope, Goal goal, List<SensorBinding> bindings,
                                       List<Reading> readings, SensorConfig config) {
        Map<String, Map<String, Reading>> latest = latestNumericBySensorAndField(readings);

        List<ZoneReading> rows = new ArrayList<>(bindings.size());
        Set<String> silent = new LinkedHashSet<>();
        for (SensorBinding b : bindings) {
            ZoneReading row = toRow(b, pickField(latest.get(b.sensorId()), b.sensorType()), config);
            rows.add(row);
            if (row.value() == null) {
                silent.add(b.sensorId());
            }
        }
        int contributing = (int) rows.stream().filter(r -> r.value() != null).count();
        String type = scopeType(scope.sensorType(), bindings);
        String unit = type == null ? null : config.unitOf(type);

        return switch (goal) {
            case REPORT -> result(scope, goal, bindings, contributing, silent, null, null, null, null, rows);
            case MAX, MIN -> {
                ZoneReading pick = extreme(rows, goal == Goal.MAX);
                yield result(scope, goal, bindings, contributing, silent,
                        pick == null ? null : pick.value(), unit,
                        pick == null ? null : pick.label(), pick, null);
            }
            case AVG -> {
                OptionalDouble avg = rows.stream()
                        .filter(r -> r.value() != null)
                        .mapToDouble(ZoneReading::value)
                        .average();
                Double mean = avg.isPresent() ? avg.getAsDouble() : null;
                SensorTypeSpec spec = type == null ? null : config.typeSpec(type);
                String label = spec == null ? null : spec.label(mean);
                yield result(scope, goal, bindings, contributing, silent, mean, unit, label, null, null);
            }
        };
    }

    /** Strictly greater (or smaller) wins, so ties go to the first room in zone order. */
    private ZoneReading extreme(List<ZoneReading> rows, boolean max) {
        ZoneReading best = null;
        for (ZoneReading r : rows) {
            if (r.value() == null) continue;
            if (best == null
                    || (max && r.value() > best.value())
                    || (!max && r.value() < best.value())) {
                best = r;
            }
        }
        return best;
    }

    private ZoneReading toRow(SensorBinding b, Reading reading, SensorConfig config) {
        Double value = reading == null ? null : reading.numericValue();
        SensorTypeSpec spec = config.typeSpec(b.sensorType());
        return new ZoneReading(
                b.element().id(),
                b.element().displayName(),
                b.element().storey(),
                b.sensorType(),
                b.sensorId(),
                value,
                spec == null ? null : spec.unit(),
                reading == null ? null : reading.time(),
                spec == null ? null : spec.label(value),
                value == null ? ZoneReading.NO_DATA : ZoneReading.OK
        );
    }

    // newest numeric point per sensor and field; non-numeric values are ignored
    private Map<String, Map<String, Reading>> latestNumericBySensorAndField(List<Reading> readings) {
        Map<String, Map<String, Reading>> out = new HashMap<>();
        for (Reading r : readings) {
            if (r.numericValue() == null) continue;
            Map<String, Reading> byField = out.computeIfAbsent(r.sensorId(), k -> new HashMap<>());
            String field = r.field() == null ? "" : r.field();
            Reading prev = byField.get(field);
            if (prev == null
                    || (r.time() != null && prev.time() != null && r.time().isAfter(prev.time()))) {
                byField.put(field, r);
            }
        }
        return out;
    }

    /**
     * The field named like the sensor type wins. Otherwise a sensor with a single numeric
     * field uses it, and a sensor with several falls back to {@value #VALUE_FIELD}.
     */
    private Reading pickField(Map<String, Reading> byField, String sensorType) {
        if (byField == null || byField.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, Reading> e : byField.entrySet()) {
            if (e.getKey().equalsIgnoreCase(sensorType)) {
                return e.getValue();
            }
        }
        if (byField.size() == 1) {
            return byField.values().iterator().next();
        }
        Reading value = byField.get(VALUE_FIELD);
        if (value == null) {
            log.debug("Sensor {} reports fields {} and none matches type '{}'",
                    byField.values().iterator().next().sensorId(), byField.keySet(), sensorType);
        }
        return value;
    }

    private String scopeType(String requested, List<SensorBinding> bindings) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        Set<String> types = new LinkedHashSet<>();
        bindings.forEach(b -> types.add(SensorMapping.typeGroup(b.sensorType())));
        return types.size() == 1 ? types.iterator().next() : null;
    }

    private ZoneMetricsResult result(Scope scope, Goal goal, List<SensorBinding> bindings, int contributing,
                                     Set<String> silent, Double value, String unit, String label,
                                     ZoneReading reading, List<ZoneReading> readings) {
        return new ZoneMetricsResult(
                scope.zone(),
                scope.sensorType(),
                goal.code(),
                scope.timeRange(),
                scope.rooms(),
                bindings.size(),
                contributing,
                List.copyOf(silent),
                value,
                unit,
                label,
                reading,
                readings
        );
    }
}
