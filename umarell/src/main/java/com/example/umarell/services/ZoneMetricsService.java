package com.example.umarell.services;

import com.example.umarell.config.SensorConfig;
import com.example.umarell.config.SensorConfigResolver;
import com.example.umarell.config.SensorMapping;
import com.example.umarell.data.FluxQuery;
import com.example.umarell.data.FluxQueryBuilder;
import com.example.umarell.data.RemoteCallGuard;
import com.example.umarell.data.TimeSeriesGateway;
import com.example.umarell.dto.ZoneMetricsResult;
import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import com.example.umarell.errors.Stage;
import com.example.umarell.models.Element;
import com.example.umarell.models.Reading;
import com.example.umarell.models.SensorBinding;
import com.example.umarell.security.InputSanitizer;
import com.example.umarell.security.SanitizeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Zone inspection: rooms in zone -> sensors of the requested type -> one batched
 * time-series read -> aggregate.
 */
@Service
public class ZoneMetricsService {

    private static final Logger log = LoggerFactory.getLogger(ZoneMetricsService.class);

    private final SensorConfigResolver configResolver;
    private final TopologyService topology;
    private final FluxQueryBuilder fluxBuilder;
    private final TimeSeriesGateway timeSeries;
    private final RemoteCallGuard guard;
    private final AggregationEngine aggregation;
    private final String defaultTimeRange;

    public ZoneMetricsService(
            SensorConfigResolver configResolver,
            TopologyService topology,
            FluxQueryBuilder fluxBuilder,
            TimeSeriesGateway timeSeries,
            RemoteCallGuard guard,
            AggregationEngine aggregation,
            @Value("${umarell.timeseries.default-range:-1h}") String defaultTimeRange
    ) {
        this.configResolver = configResolver;
        this.topology = topology;
        this.fluxBuilder = fluxBuilder;
        this.timeSeries = timeSeries;
        this.guard = guard;
        this.aggregation = aggregation;
        this.defaultTimeRange = defaultTimeRange;
    }

    public ZoneMetricsResult inspectZoneMetrics(String zone, String sensorType, String goal,
                                                String timeRange, Duration timeout) {
        Goal g = Goal.parse(goal);
        String range = InputSanitizer.sanitize(
                (timeRange == null || timeRange.isBlank()) ? defaultTimeRange : timeRange,
                SanitizeContext.TIME_RANGE);
        String type = (sensorType == null || sensorType.isBlank()) ? null : sensorType.trim();

        SensorConfig config = configResolver.loadSensorConfig();

        // 1. rooms in zone
        List<Element> rooms = topology.resolveZone(zone, timeout);

        // 2. sensors of the requested type
        List<SensorBinding> bindings = collectBindings(rooms, config, type);
        if (bindings.isEmpty()) {
            throw new InspectorException(ErrorKind.NO_SENSORS_CONFIGURED,
                    "No " + (type == null ? "" : type + " ") + "sensors configured for zone '" + zone +
                            "' (" + rooms.size() + " rooms found)");
        }
        if (type == null && g != Goal.REPORT) {
            long distinctTypes = bindings.stream()
                    .map(b -> SensorMapping.typeGroup(b.sensorType()))
                    .distinct()
                    .count();
            if (distinctTypes > 1) {
                throw InspectorException.invalidInput(
                        "Zone '" + zone + "' has " + distinctTypes + " sensor types; pass a sensor type for goal " + g.code());
            }
        }

        // 3. one batched read
        FluxQuery query = fluxBuilder.batch(bindings.stream().map(SensorBinding::sensorId).toList(), range);
        List<Reading> readings = guard.call(Stage.TIME_SERIES, timeout, () -> timeSeries.query(query));
        log.debug("Zone '{}': {} rooms, {} sensors, {} readings", zone, rooms.size(), bindings.size(), readings.size());

        // 4. aggregate
        return aggregation.aggregate(
                new AggregationEngine.Scope(zone, type, range, rooms.size()), g, bindings, readings, config);
    }

    static List<SensorBinding> collectBindings(List<Element> rooms, SensorConfig config, String type) {
        List<SensorBinding> out = new ArrayList<>();
        for (Element room : rooms) {
            for (Map.Entry<String, String> s : config.mapping().sensorsFor(room.id()).entrySet()) {
                if (type == null || type.equalsIgnoreCase(s.getKey())
                        || (SensorMapping.isUntyped(type) && SensorMapping.isUntyped(s.getKey()))) {
                    out.add(new SensorBinding(room, s.getKey(), s.getValue()));
                }
            }
        }
        return out;
    }
}
