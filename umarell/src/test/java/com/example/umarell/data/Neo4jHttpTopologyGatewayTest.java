package com.example.umarell.data;

import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import com.example.umarell.errors.Stage;
import com.example.umarell.models.Element;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class Neo4jHttpTopologyGatewayTest {

    private static final String URL = "http://neo4j.local:7474/db/neo4j/tx/commit";

    private MockRestServiceServer server;
    private Neo4jHttpTopologyGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gateway = new Neo4jHttpTopologyGateway(restTemplate, new ObjectMapper(),
                "bolt://neo4j.local:7687", "neo4j", "neo4j", "secret");
    }

    @Test
    void findElementsPostsOneStatementAndMapsRooms() {
        String auth = "Basic " + Base64.getEncoder().encodeToString("neo4j:secret".getBytes(StandardCharsets.UTF_8));
        String body = """
                {"results": [{"columns": ["r"], "data": [
                  {"row": [{"room_key": "ifc_room_001", "name": "Room 001", "storey": "2",
                            "category_it": "AULE", "category_en": "Classroom", "area": 31.5,
                            "globalid": "2O2Fr$t4X7Zf8NOew3FLOH",
                            "all_properties": "{\\"IFC_Locali\\": {\\"PBSs_III_PIANO\\": \\"2\\"}}"}], "meta": [null]},
                  {"row": [{"room_key": "ifc_room_002", "name": "Room 002", "storey": 2}], "meta": [null]}
                ]}], "errors": []}
                """;
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", auth))
                .andExpect(jsonPath("$.statements", hasSize(1)))
                .andExpect(jsonPath("$.statements[0].statement").value("MATCH (r:Room)\nRETURN r\nLIMIT 10"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        List<Element> rooms = gateway.findElements(CypherQueryBuilder.select(TopologyFilter.all(), 10));

        server.verify();
        assertThat(rooms).hasSize(2);
        Element first = rooms.get(0);
        assertThat(first.id()).isEqualTo("ifc_room_001");
        assertThat(first.categoryEn()).isEqualTo("Classroom");
        assertThat(first.area()).isEqualTo(31.5);
        assertThat(first.properties()).containsEntry("globalid", "2O2Fr$t4X7Zf8NOew3FLOH");
        assertThat(first.properties()).containsKey("psets");
        assertThat(rooms.get(1).storey()).isEqualTo("2");
    }

    @Test
    void storeErrorsBecomeQueryExecutionErrors() {
        String body = """
                {"results": [], "errors": [{"code": "Neo.ClientError.Statement.SyntaxError", "message": "Invalid input"}]}
                """;
        server.expect(requestTo(URL)).andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.findElements(CypherQueryBuilder.select(TopologyFilter.all(), 10)))
                .isInstanceOfSatisfying(InspectorException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.QUERY_EXECUTION_ERROR);
                    assertThat(e.getStage()).isEqualTo(Stage.TOPOLOGY);
                    assertThat(e.isTimeout()).isFalse();
                    assertThat(e.getMessage()).contains("Neo.ClientError.Statement.SyntaxError");
                });
    }

    @Test
    void httpFailureBecomesQueryExecutionError() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> gateway.findElements(CypherQueryBuilder.select(TopologyFilter.all(), 10)))
                .isInstanceOf(InspectorException.class)
                .hasMessageContaining("Neo4j HTTP 500");
    }

    @Test
    void executeSendsAllStatementsInOneRequest() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.statements", hasSize(2)))
                .andExpect(jsonPath("$.statements[0].parameters.room_key").value("a"))
                .andRespond(withSuccess("{\"results\": [], \"errors\": []}", MediaType.APPLICATION_JSON));

        int n = gateway.execute(List.of(
                new CypherStatement("MERGE (r:Room {room_key: $room_key})", Map.of("room_key", "a")),
                new CypherStatement("MERGE (r:Room {room_key: $room_key})", Map.of("room_key", "b"))));

        server.verify();
        assertThat(n).isEqualTo(2);
    }

    @Test
    void baseUrlNormalization() {
        assertThat(Neo4jHttpTopologyGateway.sanitizeBaseUrl("bolt://db:7687/")).isEqualTo("http://db:7474");
        assertThat(Neo4jHttpTopologyGateway.sanitizeBaseUrl("localhost:7474")).isEqualTo("http://localhost:7474");
        assertThat(Neo4jHttpTopologyGateway.sanitizeBaseUrl("https://graph.example.org/"))
                .isEqualTo("https://graph.example.org");
        assertThat(gateway.getCommitUrl()).isEqualTo(URL);
    }
}
