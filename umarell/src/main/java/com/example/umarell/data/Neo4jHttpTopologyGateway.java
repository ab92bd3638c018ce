package com.example.umarell.data;

import com.example.umarell.errors.InspectorException;
import com.example.umarell.errors.Stage;
import com.example.umarell.models.Element;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Talks to Neo4j through its HTTP transactional endpoint ({@code /db/{database}/tx/commit}).
 * Each call posts one request, so a lookup is always a single round trip.
 */
public class Neo4jHttpTopologyGateway implements TopologyGateway {

    private static final Logger log = LoggerFactory.getLogger(Neo4jHttpTopologyGateway.class);

    private static final Set<String> ELEMENT_KEYS = Set.of(
            "room_key", "name", "long_name", "storey", "category_it", "category_en", "area", "all_properties");

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String commitUrl;
    private final String authorization;

    public Neo4jHttpTopologyGateway(RestTemplate restTemplate, ObjectMapper mapper,
                                    String baseUrl, String database, String user, String password) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.commitUrl = sanitizeBaseUrl(baseUrl) + "/db/" + database + "/tx/commit";
        String credentials = (user == null ? "" : user) + ":" + (password == null ? "" : password);
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    static String sanitizeBaseUrl(String url) {
        if (url == null) return "";
        String u = url.trim();

        // bolt:// is what the import scripts use; the HTTP endpoint listens on 7474
        if (u.startsWith("bolt://") || u.startsWith("neo4j://")) {
            u = "http://" + u.substring(u.indexOf("://") + 3).replace(":7687", ":7474");
        }
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        if (!u.startsWith("http://") && !u.startsWith("https://")) {
            u = "http://" + u;
        }
        return u;
    }

    public String getCommitUrl() {
        return commitUrl;
    }

    @Override
    public List<Element> findElements(TopologyQuery query) {
        log.debug("Cypher: {}", query.cypher());

        JsonNode result = commit(List.of(new CypherStatement(query.cypher(), Map.of())));
        JsonNode data = result.path("results").path(0).path("data");

        List<Element> out = new ArrayList<>();
        for (JsonNode row : data) {
            JsonNode node = row.path("row").path(0);
            if (node.isObject()) {
                out.add(toElement((ObjectNode) node));
            }
        }
        return out;
    }

    @Override
    public int execute(List<CypherStatement> statements) {
        if (statements.isEmpty()) {
            return 0;
        }
        commit(statements);
        return statements.size();
    }

    // --- Internal: POST statements and return the parsed body, or throw with the store's error ---
    private JsonNode commit(List<CypherStatement> statements) {
        ObjectNode body = mapper.createObjectNode();
        ArrayNode stmts = body.putArray("statements");
        for (CypherStatement s : statements) {
            ObjectNode n = stmts.addObject();
            n.put("statement", s.statement());
            n.set("parameters", mapper.valueToTree(s.parameters() == null ? Map.of() : s.parameters()));
            n.putArray("resultDataContents").add("row");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, authorization);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        String raw;
        try {
            ResponseEntity<String> resp = restTemplate.exchange(
                    commitUrl, HttpMethod.POST, new HttpEntity<>(body.toString(), headers), String.class);
            raw = resp.getBody();
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw InspectorException.timedOut(Stage.TOPOLOGY, "Neo4j did not answer in time: " + e.getMessage());
            }
            throw InspectorException.queryFailed(Stage.TOPOLOGY, "Neo4j unreachable at " + commitUrl + ": " + e.getMessage(), e);
        } catch (RestClientResponseException e) {
            throw InspectorException.queryFailed(Stage.TOPOLOGY,
                    "Neo4j HTTP " + e.getStatusCode().value() + ": " + trim(e.getResponseBodyAsString()), e);
        } catch (RestClientException e) {
            throw InspectorException.queryFailed(Stage.TOPOLOGY, "Neo4j request failed: " + e.getMessage(), e);
        }

        JsonNode root;
        try {
            root = mapper.readTree(raw == null || raw.isBlank() ? "{}" : raw);
        } catch (Exception e) {
            throw InspectorException.queryFailed(Stage.TOPOLOGY, "Neo4j returned a body that is not JSON", e);
        }

        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            JsonNode first = errors.get(0);
            String msg = first.path("code").asText("Neo.Error") + ": " + first.path("message").asText("");
            log.warn("Neo4j rejected statement: {}", msg);
            throw InspectorException.queryFailed(Stage.TOPOLOGY, msg, null);
        }
        return root;
    }

    private Element toElement(ObjectNode props) {
        Map<String, Object> extra = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = props.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!ELEMENT_KEYS.contains(e.getKey())) {
                extra.put(e.getKey(), mapper.convertValue(e.getValue(), Object.class));
            }
        }

        String allProps = text(props.get("all_properties"));
        if (allProps != null) {
            try {
                extra.put("psets", mapper.readValue(allProps, new TypeReference<Map<String, Object>>() {}));
            } catch (Exception e) {
                extra.put("psets_raw", allProps);
            }
        }

        JsonNode area = props.get("area");
        return new Element(
                text(props.get("room_key")),
                text(props.get("name")),
                text(props.get("long_name")),
                text(props.get("storey")),
                text(props.get("category_it")),
                text(props.get("category_en")),
                (area != null && area.isNumber()) ? area.asDouble() : null,
                extra
        );
    }

    private static String text(JsonNode n) {
        return (n == null || n.isNull()) ? null : n.asText();
    }

    private static String trim(String s) {
        if (s == null) return "";
        s = s.replaceAll("\\s+", " ").trim();
        return s.length() > 400 ? s.substring(0, 400) + "..." : s;
    }
}
