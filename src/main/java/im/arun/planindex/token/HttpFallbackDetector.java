package im.arun.planindex.token;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Calls a remote text-region detection endpoint with retry and exponential backoff.
 *
 * <p>Request: {@code {"page_id": "...", "image_base64": "..."}}.
 * Response: {@code {"regions": [{"bbox": [x, y, w, h], "text": "...", "confidence": 0.9}]}}.
 */
public class HttpFallbackDetector implements FallbackDetector {
    private static final Logger logger = LoggerFactory.getLogger(HttpFallbackDetector.class);
    private static final long BASE_BACKOFF_MS = 500;
    private static final long MAX_BACKOFF_MS = 10000;
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final String endpoint;
    private final int maxRetries;
    private final long baseBackoffMs;
    private final ObjectMapper objectMapper;

    public HttpFallbackDetector(String endpoint, int timeoutSeconds, int maxRetries) {
        this(endpoint, timeoutSeconds, maxRetries, BASE_BACKOFF_MS);
    }

    HttpFallbackDetector(String endpoint, int timeoutSeconds, int maxRetries, long baseBackoffMs) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Fallback detector endpoint must be provided");
        }
        this.endpoint = endpoint;
        this.maxRetries = Math.max(maxRetries, 1);
        this.baseBackoffMs = baseBackoffMs;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<DetectedRegion> detect(UUID pageId, byte[] imageBytes) throws IOException {
        IOException lastFailure = null;
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                return parseRegions(executeRequest(pageId, imageBytes));
            } catch (IOException e) {
                lastFailure = e;
                logger.warn("Fallback detector call failed (attempt {}/{}): {}", attempt + 1, maxRetries, e.getMessage());
                if (attempt < maxRetries - 1) {
                    try {
                        long backoff = Math.min(baseBackoffMs * (1L << attempt), MAX_BACKOFF_MS);
                        logger.debug("Retrying in {}ms", backoff);
                        Thread.sleep(backoff);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new IOException("Interrupted during retry wait", ie);
                    }
                }
            }
        }
        throw new IOException("Max retries reached for fallback detector", lastFailure);
    }

    private String executeRequest(UUID pageId, byte[] imageBytes) throws IOException {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("page_id", String.valueOf(pageId));
        requestBody.put("image_base64", Base64.getEncoder().encodeToString(imageBytes));

        Request request = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(objectMapper.writeValueAsString(requestBody), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String errorBody = response.body() != null ? response.body().string() : "No error body";
                throw new IOException("Detector error (HTTP " + response.code() + "): " + errorBody);
            }
            if (response.body() == null) {
                throw new IOException("Detector returned an empty body");
            }
            return response.body().string();
        }
    }

    private List<DetectedRegion> parseRegions(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        JsonNode regionsNode = root.isArray() ? root : root.path("regions");
        List<DetectedRegion> regions = new ArrayList<>();
        if (!regionsNode.isArray()) {
            logger.warn("Detector response has no regions array");
            return regions;
        }
        for (JsonNode node : regionsNode) {
            regions.add(objectMapper.treeToValue(node, DetectedRegion.class));
        }
        return regions;
    }
}
