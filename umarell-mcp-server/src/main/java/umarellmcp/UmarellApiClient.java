package umarellmcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the umarell tool endpoints ({@code /api/tools/*}).
 * Never throws: transport failures come back as the same {kind, message} body the service uses.
 */
public class UmarellApiClient {

    private static final Logger log = LoggerFactory.getLogger(UmarellApiClient.class);

    public record ApiResponse(int status, String body) {
        public boolean ok() {
            return status >= 200 && status < 300;
        }
    }

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    public UmarellApiClient(String baseUrl, Duration timeout) {
        this.baseUrl = sanitizeBaseUrl(baseUrl);
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        log.info("umarell API at '{}' (timeout {}s)", this.baseUrl, timeout.toSeconds());
    }

    static String sanitizeBaseUrl(String url) {
        if (url == null) return "";
        String u = url.trim();

        // remove accidental surrounding quotes
        if ((u.startsWith("\"") && u.endsWith("\"")) || (u.startsWith("'") && u.endsWith("'"))) {
            u = u.substring(1, u.length() - 1).trim();
        }

        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }

        // localhost:8090 -> http://localhost:8090
        if (!u.startsWith("http://") && !u.startsWith("https://")) {
            u = "http://" + u;
        }
        return u;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ApiResponse post(String path, Map<String, Object> payload) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(om.writeValueAsString(payload)))
                    .build();

            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            String body = (resp.body() == null || resp.body().isBlank()) ? "{}" : resp.body();
            if (resp.statusCode() >= 400) {
                log.warn("POST {} -> HTTP {}: {}", path, resp.statusCode(), body);
            }
            return new ApiResponse(resp.statusCode(), body);

        } catch (HttpTimeoutException e) {
            log.warn("POST {} timed out after {}s", path, timeout.toSeconds());
            return new ApiResponse(504, error("QueryExecutionError",
                    "umarell service did not answer within " + timeout.toSeconds() + "s", true));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ApiResponse(499, error("QueryExecutionError", "Request cancelled", false));
        } catch (IOException | IllegalArgumentException e) {
            log.error("POST {} failed", path, e);
            return new ApiResponse(503, error("DependencyUnavailable",
                    "umarell service unreachable at " + baseUrl + ": " + e.getMessage(), false));
        }
    }

    private String error(String kind, String message, boolean timeout) {
        var node = om.createObjectNode()
                .put("kind", kind)
                .put("message", message);
        if (timeout) {
            node.put("timeout", true);
        }
        return node.toString();
    }
}
