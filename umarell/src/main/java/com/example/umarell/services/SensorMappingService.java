package com.example.umarell.services;

import com.example.umarell.config.SensorConfig;
import com.example.umarell.config.SensorConfigResolver;
import com.example.umarell.dto.SensorConfigResult;
import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import com.example.umarell.models.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class SensorMappingService {

    private static final Logger log = LoggerFactory.getLogger(SensorMappingService.class);

    static final int MAX_CANDIDATES = 10;

    private final SensorConfigResolver configResolver;
    private final TopologyService topology;

    public SensorMappingService(SensorConfigResolver configResolver, TopologyService topology) {
        this.configResolver = configResolver;
        this.topology = topology;
    }

    public SensorConfigResult checkSensorConfig(String roomName, Duration timeout) {
        SensorConfig config = configResolver.loadSensorConfig();

        List<Element> matches = topology.findByName(roomName, timeout);
        if (matches.isEmpty()) {
            throw new InspectorException(ErrorKind.ROOM_NOT_FOUND,
                    "No room called '" + roomName + "' in the building model");
        }

        Element element = matches.get(0);
        boolean ambiguous = matches.size() > 1;
        if (ambiguous) {
            log.info("'{}' matches {} rooms, using {}", roomName, matches.size(), element.id());
        }

        Map<String, String> sensors = config.mapping().sensorsFor(element.id());
        Map<String, String> units = new LinkedHashMap<>();
        for (String type : sensors.keySet()) {
            String unit = config.unitOf(type);
            if (unit != null) {
                units.put(type, unit);
            }
        }

        List<String> candidates = ambiguous
                ? matches.stream().limit(MAX_CANDIDATES).map(Element::displayName).toList()
                : null;

        return new SensorConfigResult(element, sensors, units, ambiguous, matches.size(), candidates);
    }
}
