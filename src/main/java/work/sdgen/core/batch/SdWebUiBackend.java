package work.sdgen.core.batch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.error.ConnectivityException;
import work.sdgen.core.error.SubmissionException;

/**
 * Thin client for the Stable Diffusion WebUI API. {@code txt2img} is synchronous, so every submission
 * returns a terminal handle.
 */
public final class SdWebUiBackend implements ImageBackend {
    private static final Logger log = LoggerFactory.getLogger(SdWebUiBackend.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Set<Integer> FATAL_STATUSES = Set.of(401, 403, 404);
    static final String OPTIONS_PATH = "/sdapi/v1/options";
    static final String TXT2IMG_PATH = "/sdapi/v1/txt2img";

    private final String baseUrl;
    private final HttpClient client;
    private final Duration requestTimeout;

    public SdWebUiBackend(URI baseUrl, Duration requestTimeout) {
        this(baseUrl, HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(), requestTimeout);
    }

    public SdWebUiBackend(URI baseUrl, HttpClient client, Duration requestTimeout) {
        String url = baseUrl.toString();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.client = client;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void probe() {
        String endpoint = baseUrl + OPTIONS_PATH;
        var request = HttpRequest.newBuilder(URI.create(endpoint))
            .timeout(Duration.ofSeconds(10))
            .GET()
            .build();
        try {
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() / 100 != 2) {
                throw new ConnectivityException(endpoint, "Backend answered HTTP " + response.statusCode() + " at " + endpoint, null);
            }
            log.info("Backend reachable at {}", baseUrl);
        } catch (IOException ex) {
            throw new ConnectivityException(endpoint, "Backend unreachable at " + endpoint + ": " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException(endpoint, "Interrupted while probing " + endpoint, ex);
        }
    }

    @Override
    public JobHandle submit(GenerationRequest generation) {
        String body;
        try {
            body = JSON.writeValueAsString(generation.toPayload());
        } catch (IOException ex) {
            throw new SubmissionException("Unable to serialize request: " + ex.getMessage(), false, null, ex);
        }
        var request = HttpRequest.newBuilder(URI.create(baseUrl + TXT2IMG_PATH))
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            throw new SubmissionException("Request failed: " + ex.getMessage(), false, null, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SubmissionException("Interrupted while submitting", false, null, ex);
        }
        int status = response.statusCode();
        if (status / 100 != 2) {
            throw new SubmissionException(
                "Backend answered HTTP " + status + ": " + abbreviate(response.body()), FATAL_STATUSES.contains(status), status, null);
        }
        return JobHandle.succeeded(UUID.randomUUID().toString(), parseResult(response.body()));
    }

    static Map<String, Object> parseResult(String body) {
        Map<String, Object> response;
        try {
            response = JSON.readValue(body, MAP_TYPE);
        } catch (IOException ex) {
            throw new SubmissionException("Unreadable backend response: " + ex.getMessage(), false, null, ex);
        }
        var result = new LinkedHashMap<String, Object>();
        result.put("images", response.getOrDefault("images", List.of()));
        Object info = response.get("info");
        if (info instanceof String text && !text.isBlank()) {
            try {
                Map<String, Object> parsed = JSON.readValue(text, MAP_TYPE);
                if (parsed.get("seed") instanceof Number seed) {
                    result.put("seed", seed.longValue());
                }
                result.put("info", parsed);
            } catch (IOException ex) {
                log.debug("Backend info is not JSON: {}", ex.getMessage());
                result.put("info", text);
            }
        }
        return result;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
