package com.example.umarell.data;

import java.util.List;

/** A batched Flux read and the distinct sensor ids it covers. */
public record FluxQuery(String flux, List<String> sensorIds, String timeRange) {
}
