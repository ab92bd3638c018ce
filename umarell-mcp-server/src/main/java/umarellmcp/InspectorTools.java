package umarellmcp;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool definitions and handlers. Each handler forwards the structured arguments to the
 * matching REST operation and hands back the JSON unchanged; errors keep their
 * {kind, message} body and are flagged as error results.
 */
public class InspectorTools {

    public static final String QUERY_TOPOLOGY = "query_topology";
    public static final String CHECK_SENSOR_CONFIG = "check_sensor_config";
    public static final String INSPECT_ZONE_METRICS = "inspect_zone_metrics";

    private static final String QUERY_TOPOLOGY_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "category":      { "type": "string", "description": "Room category, Italian or English (e.g. Ufficio, Office)" },
                "floor":         { "type": "string", "description": "Storey id, exact match (e.g. 002, 00S)" },
                "name_contains": { "type": "string", "description": "Part of the room name" },
                "timeout_ms":    { "type": "integer", "description": "Optional deadline in milliseconds" }
              }
            }
            """;

    private static final String CHECK_SENSOR_CONFIG_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "room_name":  { "type": "string", "description": "Room name or part of it (e.g. Room 001)" },
                "timeout_ms": { "type": "integer", "description": "Optional deadline in milliseconds" }
              },
              "required": ["room_name"]
            }
            """;

    private static final String INSPECT_ZONE_METRICS_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "zone":        { "type": "string", "description": "'whole building', a floor id or a room category" },
                "sensor_type": { "type": "string", "description": "temperature, co2, humidity, ... (all types if omitted)" },
                "goal":        { "type": "string", "enum": ["report", "max", "min", "avg"], "default": "report" },
                "time_range":  { "type": "string", "description": "Flux duration such as -1h or -24h", "default": "-1h" },
                "timeout_ms":  { "type": "integer", "description": "Optional deadline in milliseconds" }
              },
              "required": ["zone"]
            }
            """;

    private final UmarellApiClient api;

    public InspectorTools(UmarellApiClient api) {
        this.api = api;
    }

    public List<McpSchema.Tool> definitions(McpJsonMapper jsonMapper) {
        return List.of(
                McpSchema.Tool.builder()
                        .name(QUERY_TOPOLOGY)
                        .title("Query building topology")
                        .description("List and count rooms by category, floor or name fragment.")
                        .inputSchema(jsonMapper, QUERY_TOPOLOGY_SCHEMA)
                        .build(),
                McpSchema.Tool.builder()
                        .name(CHECK_SENSOR_CONFIG)
                        .title("Check sensor configuration")
                        .description("Find a room and the sensors (with units) configured for it.")
                        .inputSchema(jsonMapper, CHECK_SENSOR_CONFIG_SCHEMA)
                        .build(),
                McpSchema.Tool.builder()
                        .name(INSPECT_ZONE_METRICS)
                        .title("Inspect zone metrics")
                        .description("Latest sensor values for a zone, reported or reduced to max/min/avg.")
                        .inputSchema(jsonMapper, INSPECT_ZONE_METRICS_SCHEMA)
                        .build()
        );
    }

    public McpSchema.CallToolResult call(String tool, Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        return switch (tool) {
            case QUERY_TOPOLOGY -> forward("/api/tools/query-topology",
                    pick(args, "category", "floor", "name_contains", "timeout_ms"));
            case CHECK_SENSOR_CONFIG -> forward("/api/tools/check-sensor-config",
                    pick(args, "room_name", "timeout_ms"));
            case INSPECT_ZONE_METRICS -> {
                Map<String, Object> payload = pick(args, "zone", "sensor_type", "goal", "time_range", "timeout_ms");
                // some models send "type" instead of "sensor_type"
                if (!payload.containsKey("sensor_type") && present(args.get("type"))) {
                    payload.put("sensor_type", args.get("type").toString().trim());
                }
                yield forward("/api/tools/inspect-zone-metrics", payload);
            }
            default -> new McpSchema.CallToolResult(
                    "{\"kind\":\"InvalidInput\",\"message\":\"Unknown tool: " + tool.replace("\"", "'") + "\"}", true);
        };
    }

    private McpSchema.CallToolResult forward(String path, Map<String, Object> payload) {
        UmarellApiClient.ApiResponse resp = api.post(path, payload);
        return new McpSchema.CallToolResult(resp.body(), !resp.ok());
    }

    // copies the listed keys, dropping nulls and blank strings
    static Map<String, Object> pick(Map<String, Object> args, String... keys) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String k : keys) {
            Object v = args.get(k);
            if (!present(v)) continue;
            out.put(k, v instanceof String s ? s.trim() : v);
        }
        return out;
    }

    private static boolean present(Object v) {
        return v != null && !(v instanceof String s && s.isBlank());
    }
}
