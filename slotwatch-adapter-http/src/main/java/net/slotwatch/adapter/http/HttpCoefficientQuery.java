package net.slotwatch.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.slotwatch.core.exception.UpstreamAuthException;
import net.slotwatch.core.exception.UpstreamException;
import net.slotwatch.core.exception.UpstreamRateLimitedException;
import net.slotwatch.core.model.SlotOffer;
import net.slotwatch.core.spi.CoefficientQuery;
import net.slotwatch.core.util.MessageSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.DateTimeException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 수용 계수 조회 HTTP 어댑터.
 * <p>
 * 상태 코드 해석: 401/403 → {@link UpstreamAuthException}, 429 → {@link UpstreamRateLimitedException}
 * (Retry-After 초, 없으면 60초), 그 밖의 400 이상과 I/O 오류 → {@link UpstreamException}.
 * 해석할 수 없는 원소는 경고만 남기고 건너뛴다.
 */
public class HttpCoefficientQuery implements CoefficientQuery {
    private static final Logger log = LoggerFactory.getLogger(HttpCoefficientQuery.class);
    static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);
    private static final String PATH = "/api/v1/acceptance/coefficients";

    private final HttpClient http;
    private final ObjectMapper json;
    private final UpstreamHttpSettings settings;

    public HttpCoefficientQuery(ObjectMapper json, UpstreamHttpSettings settings) {
        this.json = Objects.requireNonNull(json, "json");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.http = HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .build();
    }

    @Override
    public List<SlotOffer> query(String credential, Set<Long> warehouseIds) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url(warehouseIds)))
                .header("Accept", "application/json")
                .header("Authorization", credential)
                .timeout(settings.requestTimeout())
                .GET()
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamException("coefficients request failed: " + e.getMessage(), e);
        }

        int status = resp.statusCode();
        log.debug("coefficients response status {} length {}", status,
                resp.body() != null ? resp.body().length() : 0);
        if (status == 401 || status == 403) {
            throw new UpstreamAuthException("coefficients rejected credential (status " + status + ")");
        }
        if (status == 429) {
            Duration retryAfter = retryAfter(resp);
            throw new UpstreamRateLimitedException("coefficients rate limited, retry after " + retryAfter.toSeconds() + "s", retryAfter);
        }
        if (status >= 400) {
            throw new UpstreamException("coefficients status " + status + ": " + MessageSanitizer.sanitize(resp.body()));
        }
        return parse(resp.body());
    }

    String url(Set<Long> warehouseIds) {
        String base = settings.suppliesUrl() + PATH;
        if (warehouseIds == null || warehouseIds.isEmpty()) return base;
        return base + "?warehouseIDs=" + warehouseIds.stream()
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }

    List<SlotOffer> parse(String body) throws UpstreamException {
        if (body == null || body.isBlank()) return List.of();
        JsonNode root;
        try {
            root = json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("coefficients body is not JSON: " + e.getOriginalMessage(), e);
        }
        if (!root.isArray()) {
            log.warn("coefficients body is not an array, ignoring");
            return List.of();
        }

        List<SlotOffer> out = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            try {
                out.add(json.treeToValue(node, CoefficientEntry.class).toOffer());
            } catch (JsonProcessingException | IllegalArgumentException | DateTimeException e) {
                log.warn("skipping coefficient entry {}: {}", MessageSanitizer.truncate(node.toString(), 120), e.getMessage());
            }
        }
        return out;
    }

    static Duration retryAfter(HttpResponse<?> resp) {
        String raw = resp.headers().firstValue("Retry-After").orElse(null);
        if (raw == null || raw.isBlank()) return DEFAULT_RETRY_AFTER;
        try {
            long seconds = Long.parseLong(raw.trim());
            return seconds < 0 ? DEFAULT_RETRY_AFTER : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            log.debug("unparseable Retry-After '{}', using default", raw);
            return DEFAULT_RETRY_AFTER;
        }
    }
}
