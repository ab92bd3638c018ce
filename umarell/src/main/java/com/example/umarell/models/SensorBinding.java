package com.example.umarell.models;

/** A (room, sensor type, sensor id) triple collected for a zone. */
public record SensorBinding(Element element, String sensorType, String sensorId) {
}
