package umarellmcp;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        McpJsonMapper jsonMapper = McpJsonMapper.createDefault();

        // stdout is the protocol channel; logs go to stderr (see logback.xml)
        StdioServerTransportProvider transportProvider =
                new StdioServerTransportProvider(jsonMapper);

        // Read umarell settings from environment (safe defaults)
        String umarellUrl = env("UMARELL_URL", "http://localhost:8090");
        long timeoutSeconds = envLong("UMARELL_TIMEOUT_SECONDS", 30);

        UmarellApiClient api = new UmarellApiClient(umarellUrl, Duration.ofSeconds(timeoutSeconds));
        InspectorTools tools = new InspectorTools(api);

        var spec = McpServer.sync(transportProvider)
                .serverInfo("umarell-mcp-server", "0.0.1")
                .capabilities(McpSchema.ServerCapabilities.builder()
                        .tools(true)
                        .build());

        for (McpSchema.Tool tool : tools.definitions(jsonMapper)) {
            spec.tool(tool, (exchange, arguments) -> tools.call(tool.name(), arguments));
        }
        var server = spec.build();

        log.info("MCP server running (STDIO) with tools {}, {}, {}. Waiting for a client...",
                InspectorTools.QUERY_TOPOLOGY, InspectorTools.CHECK_SENSOR_CONFIG, InspectorTools.INSPECT_ZONE_METRICS);
        Runtime.getRuntime().addShutdownHook(new Thread(server::closeGracefully));
        Thread.currentThread().join();
    }

    private static String env(String key, String defaultVal) {
        String v = System.getenv(key);
        return (v == null || v.isBlank()) ? defaultVal : v;
    }

    private static long envLong(String key, long defaultVal) {
        String v = env(key, null);
        if (v == null) return defaultVal;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            log.warn("{}='{}' is not a number, using {}", key, v, defaultVal);
            return defaultVal;
        }
    }
}
