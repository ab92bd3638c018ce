package com.example.umarell.config;

import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Finds {@code sensor_config.json} on an ordered list of locations and keeps the parsed
 * result for the life of the process.
 *
 * <p>Concurrent first callers may each read the file, but only the first result is published
 * and every caller gets that same instance. No lock is held while reading.
 */
public class SensorConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(SensorConfigResolver.class);

    private final List<Path> candidates;
    private final ObjectMapper mapper;
    private final AtomicReference<SensorConfig> cached = new AtomicReference<>();

    public SensorConfigResolver(List<Path> candidates, ObjectMapper mapper) {
        this.candidates = List.copyOf(candidates);
        this.mapper = mapper;
    }

    public SensorConfig loadSensorConfig() {
        SensorConfig current = cached.get();
        if (current != null) {
            return current;
        }
        SensorConfig loaded = readFirstCandidate();
        if (cached.compareAndSet(null, loaded)) {
            log.info("Loaded sensor config from {} ({} rooms, {} sensor types)",
                    loaded.source(), loaded.mapping().size(), loaded.sensorTypes().size());
            return loaded;
        }
        return cached.get();
    }

    /** Re-reads the file and replaces the cached value. Readers keep the old one until this returns. */
    public SensorConfig reload() {
        SensorConfig loaded = readFirstCandidate();
        cached.set(loaded);
        log.info("Reloaded sensor config from {} ({} rooms)", loaded.source(), loaded.mapping().size());
        return loaded;
    }

    public void invalidate() {
        cached.set(null);
    }

    public List<Path> getCandidates() {
        return candidates;
    }

    private SensorConfig readFirstCandidate() {
        for (Path path : candidates) {
            if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
                log.debug("Sensor config candidate {} not present", path);
                continue;
            }

            JsonNode root;
            try {
                root = mapper.readTree(path.toFile());
            } catch (IOException e) {
                log.warn("Skipping sensor config candidate {}: not valid JSON ({})", path, e.getMessage());
                continue;
            }
            if (root == null || !root.isObject()) {
                log.warn("Skipping sensor config candidate {}: top level is not a JSON object", path);
                continue;
            }

            return SensorConfig.fromJson(root, path);
        }

        throw new InspectorException(ErrorKind.CONFIG_NOT_FOUND,
                "No readable sensor_config.json found. Looked in: " + candidates);
    }
}
