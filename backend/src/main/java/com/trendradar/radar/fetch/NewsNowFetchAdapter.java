package com.trendradar.radar.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendradar.config.RadarProperties;
import com.trendradar.radar.model.RawItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Fetch adapter for NewsNow-style hot-list endpoints:
 * {@code GET {baseUrl}/api/s?id={platform}&latest}.
 */
@Service
public class NewsNowFetchAdapter implements PlatformFetchAdapter {
    private static final Logger log = LoggerFactory.getLogger(NewsNowFetchAdapter.class);
    private static final Set<String> ACCEPTED_STATUSES = Set.of("success", "cache");

    private final RadarProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public NewsNowFetchAdapter(
        RadarProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getFetch().getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public List<RawItem> fetch(String platformId, int round) {
        URI uri = buildUri(platformId);
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getFetch().getTimeoutSeconds()))
            .header("User-Agent", properties.getFetch().getUserAgent())
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new FetchException(platformId, "timeout", e);
        } catch (IOException e) {
            throw new FetchException(platformId, "io_error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(platformId, "interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new FetchException(platformId, "http_" + response.statusCode());
        }
        List<RawItem> items = parse(platformId, response.body(), Instant.now());
        log.debug("Fetched {} items from {} (round {})", items.size(), platformId, round);
        return items;
    }

    List<RawItem> parse(String platformId, String body, Instant fetchedAt) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new FetchException(platformId, "invalid_json", e);
        }
        if (root == null || !root.isObject()) {
            throw new FetchException(platformId, "invalid_json");
        }
        String status = root.path("status").asText("");
        if (!ACCEPTED_STATUSES.contains(status)) {
            throw new FetchException(platformId, "unexpected_status: " + status);
        }

        List<RawItem> items = new ArrayList<>();
        int rank = 0;
        for (JsonNode node : root.path("items")) {
            String title = node.path("title").asText("").strip();
            if (title.isEmpty()) {
                continue;
            }
            rank++;
            items.add(new RawItem(
                title,
                textOrNull(node, "url"),
                textOrNull(node, "mobileUrl"),
                platformId,
                rank,
                fetchedAt
            ));
        }
        return items;
    }

    private URI buildUri(String platformId) {
        String base = properties.getFetch().getBaseUrl();
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        String encoded = URLEncoder.encode(platformId, StandardCharsets.UTF_8);
        try {
            return URI.create(trimmed + "/api/s?id=" + encoded + "&latest");
        } catch (IllegalArgumentException e) {
            throw new FetchException(platformId, "invalid_url", e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().strip();
        return text.isEmpty() ? null : text;
    }
}
