package com.example.umarell.services;

import com.example.umarell.BuildingFixture;
import com.example.umarell.config.SensorConfigResolver;
import com.example.umarell.data.InMemoryTopologyGateway;
import com.example.umarell.data.RemoteCallGuard;
import com.example.umarell.dto.SensorConfigResult;
import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import com.example.umarell.models.Element;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SensorMappingServiceTest {

    private static final Element ATRIUM = BuildingFixture.room("ifc_atrium", "Atrium", "0", "CONNETTIVO", "Corridor");

    private final RemoteCallGuard guard = new RemoteCallGuard(2, Duration.ofSeconds(2));
    private InMemoryTopologyGateway gateway;
    private SensorConfigResolver resolver;
    private SensorMappingService service;

    @BeforeEach
    void setUp() {
        List<Element> rooms = new ArrayList<>(BuildingFixture.elements());
        rooms.add(ATRIUM);
        gateway = new InMemoryTopologyGateway(rooms);
        resolver = mock(SensorConfigResolver.class);
        when(resolver.loadSensorConfig()).thenReturn(BuildingFixture.sensorConfig());
        service = new SensorMappingService(resolver,
                new TopologyService(gateway, guard, 500, List.of("whole building")));
    }

    @AfterEach
    void tearDown() {
        guard.shutdown();
    }

    @Test
    void mappedRoomReturnsItsSensors() {
        SensorConfigResult result = service.checkSensorConfig("Room 001", null);

        assertThat(result.element().id()).isEqualTo("ifc_room_001");
        assertThat(result.sensors()).isEqualTo(Map.of("temperature", "sensor_001_temp"));
        assertThat(result.units()).isEqualTo(Map.of("temperature", "°C"));
        assertThat(result.ambiguous()).isFalse();
        assertThat(result.matchCount()).isEqualTo(1);
        assertThat(result.candidates()).isNull();
    }

    @Test
    void unmappedRoomHasNoSensorsButIsNotAnError() {
        SensorConfigResult result = service.checkSensorConfig("atrium", null);

        assertThat(result.element().id()).isEqualTo("ifc_atrium");
        assertThat(result.sensors()).isEmpty();
        assertThat(result.units()).isEmpty();
    }

    @Test
    void ambiguousNameUsesFirstMatchAndSaysSo() {
        SensorConfigResult result = service.checkSensorConfig("Room 00", null);

        assertThat(result.ambiguous()).isTrue();
        assertThat(result.matchCount()).isEqualTo(3);
        assertThat(result.element().id()).isEqualTo("ifc_room_001");
        assertThat(result.candidates()).containsExactly("Room 001", "Room 002", "Room 003");
    }

    @Test
    void unknownRoomIsRoomNotFound() {
        assertThatThrownBy(() -> service.checkSensorConfig("Room 999", null))
                .isInstanceOf(InspectorException.class)
                .extracting(e -> ((InspectorException) e).getKind())
                .isEqualTo(ErrorKind.ROOM_NOT_FOUND);
    }

    @Test
    void missingConfigFailsBeforeTouchingTheStore() {
        when(resolver.loadSensorConfig())
                .thenThrow(new InspectorException(ErrorKind.CONFIG_NOT_FOUND, "no sensor_config.json"));

        assertThatThrownBy(() -> service.checkSensorConfig("Room 001", null))
                .isInstanceOf(InspectorException.class)
                .extracting(e -> ((InspectorException) e).getKind())
                .isEqualTo(ErrorKind.CONFIG_NOT_FOUND);
        assertThat(gateway.reads()).isZero();
    }
}
