package com.example.umarell.controllers;

import com.example.umarell.config.SensorConfig;
import com.example.umarell.config.SensorConfigResolver;
import com.example.umarell.importer.ImportReport;
import com.example.umarell.importer.SpaceRecord;
import com.example.umarell.importer.TopologyImporter;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final SensorConfigResolver configResolver;
    private final TopologyImporter importer;

    public AdminController(SensorConfigResolver configResolver, TopologyImporter importer) {
        this.configResolver = configResolver;
        this.importer = importer;
    }

    // --------------------
    // Sensor config
    // --------------------
    @PostMapping("/sensor-config/reload")
    public Map<String, Object> reloadSensorConfig() {
        SensorConfig cfg = configResolver.reload();

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("source", cfg.source().toString());
        out.put("rooms", cfg.mapping().size());
        out.put("sensor_types", cfg.sensorTypes().keySet());
        return out;
    }

    // --------------------
    // Topology import (spaces already extracted from the building model)
    // --------------------
    @PostMapping("/topology/import")
    public ImportReport importTopology(@RequestBody List<SpaceRecord> spaces,
                                       @RequestParam(name = "timeout_ms", required = false) Long timeoutMs) {
        Duration timeout = (timeoutMs == null || timeoutMs <= 0) ? null : Duration.ofMillis(timeoutMs);
        return importer.importSpaces(spaces, timeout);
    }
}
