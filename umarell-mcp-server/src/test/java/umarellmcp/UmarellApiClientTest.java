package umarellmcp;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class UmarellApiClientTest {

    private HttpServer server;
    private final AtomicReference<String> received = new AtomicReference<>();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/tools/check-sensor-config", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] out = "{\"kind\":\"RoomNotFound\",\"message\":\"nope\"}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(404, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        });
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    @Test
    void postsJsonAndKeepsErrorBody() {
        var client = new UmarellApiClient("127.0.0.1:" + server.getAddress().getPort() + "/", Duration.ofSeconds(5));

        UmarellApiClient.ApiResponse resp = client.post("/api/tools/check-sensor-config", Map.of("room_name", "Room 999"));

        assertThat(resp.status()).isEqualTo(404);
        assertThat(resp.ok()).isFalse();
        assertThat(resp.body()).contains("RoomNotFound");
        assertThat(received.get()).isEqualTo("{\"room_name\":\"Room 999\"}");
    }

    @Test
    void unreachableServiceIsDependencyUnavailable() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        var client = new UmarellApiClient("http://127.0.0.1:" + port, Duration.ofSeconds(2));

        UmarellApiClient.ApiResponse resp = client.post("/api/tools/query-topology", Map.of());

        assertThat(resp.ok()).isFalse();
        assertThat(resp.body()).contains("DependencyUnavailable");
    }

    @Test
    void sanitizeBaseUrlStripsQuotesAndSlashes() {
        assertThat(UmarellApiClient.sanitizeBaseUrl(" \"localhost:8090/\" ")).isEqualTo("http://localhost:8090");
        assertThat(UmarellApiClient.sanitizeBaseUrl("https://inspector.example.org//")).isEqualTo("https://inspector.example.org");
        assertThat(UmarellApiClient.sanitizeBaseUrl(null)).isEmpty();
    }
}
