package com.peerwarden.routeros;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

/**
 * HTTP client for the MikroTik RouterOS v7 REST API.
 *
 * Every menu path (for example {@code /interface/wireguard/peers}) is exposed
 * through the four generic operations RouterOS supports: print, add, set and
 * remove. All item attributes travel as strings, exactly as RouterOS reports
 * them.
 *
 * Authentication: HTTP Basic with a RouterOS user that has the {@code rest-api}
 * and {@code write} policies.
 */
public class RouterOsClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterOsClient.class);

    private final String baseUrl;
    private final String authorization;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private RouterOsClient(Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.baseUrl) + "/rest";
        String credentials = builder.username + ":" + (builder.password != null ? builder.password : "");
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        this.requestTimeout = builder.requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    // ==================== Menu Operations ====================

    /**
     * Lists every item under a menu path.
     */
    public List<Map<String, String>> print(String menuPath) throws IOException, InterruptedException {
        JsonNode body = send("GET", menuPath, null);
        List<Map<String, String>> items = new ArrayList<>();
        if (body == null || body.isNull() || body.isMissingNode()) {
            return items;
        }
        if (body.isArray()) {
            for (JsonNode item : body) {
                items.add(toAttributes(item));
            }
        } else if (body.isObject()) {
            items.add(toAttributes(body));
        }
        return items;
    }

    /**
     * Adds an item under a menu path and classifies the response by where it
     * carries the new item's identifier.
     */
    public CreateOutcome add(String menuPath, Map<String, String> attributes)
            throws IOException, InterruptedException {
        JsonNode body = send("POST", menuPath + "/add", attributes);
        CreateOutcome outcome = CreateOutcome.classify(body);
        log.debug("RouterOS add on {} classified as {}", menuPath, outcome.getClass().getSimpleName());
        return outcome;
    }

    /**
     * Changes attributes of an existing item.
     */
    public void set(String menuPath, String id, Map<String, String> attributes)
            throws IOException, InterruptedException {
        send("PATCH", menuPath + "/" + encodeId(id), attributes);
    }

    /**
     * Removes an item.
     */
    public void remove(String menuPath, String id) throws IOException, InterruptedException {
        send("DELETE", menuPath + "/" + encodeId(id), null);
    }

    // ==================== HTTP Methods ====================

    private JsonNode send(String method, String path, Map<String, String> body)
            throws IOException, InterruptedException {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Authorization", authorization)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .method(method, publisher)
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        String responseBody = response.body();

        if (response.statusCode() / 100 != 2) {
            throw toException(response.statusCode(), responseBody);
        }
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        return objectMapper.readTree(responseBody);
    }

    private RouterOsException toException(int status, String responseBody) {
        String message = null;
        String detail = null;
        if (responseBody != null && !responseBody.isBlank()) {
            try {
                JsonNode error = objectMapper.readTree(responseBody);
                message = error.path("message").asText(null);
                detail = error.path("detail").asText(null);
            } catch (IOException e) {
                detail = responseBody;
            }
        }
        return new RouterOsException(status, message, detail);
    }

    private static Map<String, String> toAttributes(JsonNode item) {
        Map<String, String> attributes = new LinkedHashMap<>();
        item.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            attributes.put(entry.getKey(), value.isValueNode() ? value.asText() : value.toString());
        });
        return attributes;
    }

    private static String encodeId(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing on JDK 17
    }

    // ==================== Builder ====================

    public static class Builder {
        private String baseUrl = "https://192.168.88.1";
        private String username = "admin";
        private String password;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(10);

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public RouterOsClient build() {
            Objects.requireNonNull(baseUrl, "Base URL is required");
            Objects.requireNonNull(username, "Username is required");
            Objects.requireNonNull(connectTimeout, "Connect timeout is required");
            Objects.requireNonNull(requestTimeout, "Request timeout is required");
            return new RouterOsClient(this);
        }
    }
}
