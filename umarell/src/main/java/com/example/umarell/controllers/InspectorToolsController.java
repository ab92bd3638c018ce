package com.example.umarell.controllers;

import com.example.umarell.dto.SensorConfigRequest;
import com.example.umarell.dto.SensorConfigResult;
import com.example.umarell.dto.TopologyRequest;
import com.example.umarell.dto.TopologyResult;
import com.example.umarell.dto.ZoneMetricsRequest;
import com.example.umarell.dto.ZoneMetricsResult;
import com.example.umarell.services.SensorMappingService;
import com.example.umarell.services.TopologyService;
import com.example.umarell.services.ZoneMetricsService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * The three tool operations the chat front-end calls. Failures are turned into
 * {@code {kind, message}} bodies by {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/tools")
public class InspectorToolsController {

    private final TopologyService topology;
    private final SensorMappingService sensorMapping;
    private final ZoneMetricsService zoneMetrics;

    public InspectorToolsController(TopologyService topology,
                                    SensorMappingService sensorMapping,
                                    ZoneMetricsService zoneMetrics) {
        this.topology = topology;
        this.sensorMapping = sensorMapping;
        this.zoneMetrics = zoneMetrics;
    }

    @PostMapping("/query-topology")
    public TopologyResult queryTopology(@RequestBody(required = false) TopologyRequest req) {
        if (req == null) {
            req = new TopologyRequest(null, null, null, null);
        }
        return topology.queryTopology(req.category(), req.floor(), req.nameContains(), timeout(req.timeoutMs()));
    }

    @PostMapping("/check-sensor-config")
    public SensorConfigResult checkSensorConfig(@RequestBody SensorConfigRequest req) {
        return sensorMapping.checkSensorConfig(req.roomName(), timeout(req.timeoutMs()));
    }

    @PostMapping("/inspect-zone-metrics")
    public ZoneMetricsResult inspectZoneMetrics(@RequestBody ZoneMetricsRequest req) {
        return zoneMetrics.inspectZoneMetrics(
                req.zone(), req.sensorType(), req.goal(), req.timeRange(), timeout(req.timeoutMs()));
    }

    // null or non-positive means "use the default"
    private static Duration timeout(Long ms) {
        return (ms == null || ms <= 0) ? null : Duration.ofMillis(ms);
    }
}
