package com.example.umarell.controllers;

import com.example.umarell.BuildingFixture;
import com.example.umarell.dto.SensorConfigResult;
import com.example.umarell.dto.TopologyResult;
import com.example.umarell.dto.ZoneMetricsResult;
import com.example.umarell.dto.ZoneReading;
import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import com.example.umarell.errors.Stage;
import com.example.umarell.services.SensorMappingService;
import com.example.umarell.services.TopologyService;
import com.example.umarell.services.ZoneMetricsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = InspectorToolsController.class)
class InspectorToolsControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private TopologyService topology;

    @MockBean
    private SensorMappingService sensorMapping;

    @MockBean
    private ZoneMetricsService zoneMetrics;

    @Test
    void queryTopologyReturnsSnakeCaseElements() throws Exception {
        when(topology.queryTopology("window", "2", null, null)).thenReturn(new TopologyResult(1,
                List.of(BuildingFixture.ROOM_001), false));

        mvc.perform(post("/api/tools/query-topology")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\": \"window\", \"floor\": \"2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.items[0].id").value("ifc_room_001"))
                .andExpect(jsonPath("$.items[0].category_en").value("Window Office"))
                .andExpect(jsonPath("$.truncated").value(false));
    }

    @Test
    void queryTopologyWithoutBodyMeansNoFilter() throws Exception {
        when(topology.queryTopology(null, null, null, null)).thenReturn(new TopologyResult(0, List.of(), false));

        mvc.perform(post("/api/tools/query-topology"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void checkSensorConfigPassesRoomNameAndTimeout() throws Exception {
        when(sensorMapping.checkSensorConfig("Room 001", Duration.ofMillis(1500))).thenReturn(new SensorConfigResult(
                BuildingFixture.ROOM_001, Map.of("temperature", "sensor_001_temp"), Map.of("temperature", "°C"),
                false, 1, null));

        mvc.perform(post("/api/tools/check-sensor-config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_name\": \"Room 001\", \"timeout_ms\": 1500}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sensors.temperature").value("sensor_001_temp"))
                .andExpect(jsonPath("$.match_count").value(1))
                .andExpect(jsonPath("$.candidates").doesNotExist());
    }

    @Test
    void inspectZoneMetricsAcceptsTypeAlias() throws Exception {
        ZoneReading top = new ZoneReading("ifc_room_003", "Room 003", "2", "co2", "sensor_003_co2",
                1850.0, "ppm", Instant.parse("2026-10-19T09:00:00Z"), "poor air quality", ZoneReading.OK);
        when(zoneMetrics.inspectZoneMetrics("whole building", "co2", "max", "-1h", null)).thenReturn(
                new ZoneMetricsResult("whole building", "co2", "max", "-1h", 5, 3, 3, List.of(),
                        1850.0, "ppm", "poor air quality", top, null));

        mvc.perform(post("/api/tools/inspect-zone-metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"zone\": \"whole building\", \"type\": \"co2\", \"goal\": \"max\", \"time_range\": \"-1h\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value(1850.0))
                .andExpect(jsonPath("$.reading.room_id").value("ifc_room_003"))
                .andExpect(jsonPath("$.reading.time").value("2026-10-19T09:00:00Z"))
                .andExpect(jsonPath("$.silent_sensors").isEmpty())
                .andExpect(jsonPath("$.readings").doesNotExist());
    }

    @Test
    void roomNotFoundIs404WithKind() throws Exception {
        when(sensorMapping.checkSensorConfig(any(), isNull()))
                .thenThrow(new InspectorException(ErrorKind.ROOM_NOT_FOUND, "No room called 'Room 999'"));

        mvc.perform(post("/api/tools/check-sensor-config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_name\": \"Room 999\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("RoomNotFound"))
                .andExpect(jsonPath("$.message").value("No room called 'Room 999'"))
                .andExpect(jsonPath("$.stage").doesNotExist());
    }

    @Test
    void timeoutIs504WithStage() throws Exception {
        when(zoneMetrics.inspectZoneMetrics(any(), any(), any(), any(), any()))
                .thenThrow(InspectorException.timedOut(Stage.TIME_SERIES, "time_series store did not answer"));

        mvc.perform(post("/api/tools/inspect-zone-metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"zone\": \"2\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.kind").value("QueryExecutionError"))
                .andExpect(jsonPath("$.stage").value("time_series"))
                .andExpect(jsonPath("$.timeout").value(true));
    }

    @Test
    void noSensorsIs422() throws Exception {
        when(zoneMetrics.inspectZoneMetrics(any(), any(), any(), any(), any()))
                .thenThrow(new InspectorException(ErrorKind.NO_SENSORS_CONFIGURED, "No co2 sensors"));

        mvc.perform(post("/api/tools/inspect-zone-metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"zone\": \"storage\", \"sensor_type\": \"co2\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("NoSensorsConfigured"));
    }

    @Test
    void unreadableBodyIsInvalidInput() throws Exception {
        mvc.perform(post("/api/tools/check-sensor-config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_name\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("InvalidInput"));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        when(topology.queryTopology(any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        mvc.perform(post("/api/tools/query-topology")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind").value("InternalError"));
    }

    @Test
    void zeroTimeoutMeansDefault() throws Exception {
        when(topology.queryTopology(any(), any(), any(), any())).thenReturn(new TopologyResult(0, List.of(), false));

        mvc.perform(post("/api/tools/query-topology")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeout_ms\": 0}"))
                .andExpect(status().isOk());

        verify(topology).queryTopology(null, null, null, null);
    }
}
