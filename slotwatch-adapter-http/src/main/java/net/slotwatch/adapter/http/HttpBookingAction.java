package net.slotwatch.adapter.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.slotwatch.core.exception.UpstreamAuthException;
import net.slotwatch.core.model.BookingResult;
import net.slotwatch.core.model.SessionHandle;
import net.slotwatch.core.spi.BookingAction;
import net.slotwatch.core.util.MessageSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * REST 예약 엔드포인트로 슬롯을 확보한다.
 * 2xx 성공, 요청 자체가 틀린 4xx 는 재시도해도 소용없으므로 TERMINAL,
 * 408/429/5xx 와 I/O 오류는 RETRYABLE. 401/403 은 {@link UpstreamAuthException}.
 */
public class HttpBookingAction implements BookingAction {
    private static final Logger log = LoggerFactory.getLogger(HttpBookingAction.class);
    private static final Set<Integer> RETRYABLE_4XX = Set.of(408, 429);

    private final HttpClient http;
    private final ObjectMapper json;
    private final UpstreamHttpSettings settings;

    public HttpBookingAction(ObjectMapper json, UpstreamHttpSettings settings) {
        this.json = Objects.requireNonNull(json, "json");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.http = HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .build();
    }

    @Override
    public BookingResult book(SessionHandle session, String orderRef, LocalDate date, long warehouseId) throws Exception {
        String url = settings.marketplaceUrl() + "/api/v3/supplies/"
                + URLEncoder.encode(orderRef, StandardCharsets.UTF_8) + "/book";
        String body = json.writeValueAsString(new BookRequest(warehouseId, date.toString()));

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .header("Authorization", session.apiToken())
                .timeout(settings.requestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.info("booking order={} warehouse={} date={}", orderRef, warehouseId, date);
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("booking request failed order={}: {}", orderRef, e.toString());
            return BookingResult.retryable("request failed: " + e.getMessage());
        }
        int status = resp.statusCode();
        if (status == 401 || status == 403) {
            // 날짜 문제가 아니라 세션 문제. 재인증 전까지 진행 불가
            throw new UpstreamAuthException("booking rejected session (status " + status + ")");
        }
        return classify(status, resp.body());
    }

    static BookingResult classify(int status, String body) {
        if (status >= 200 && status < 300) {
            return BookingResult.succeeded("booked (status " + status + ")");
        }
        String detail = "status " + status + (body == null || body.isBlank() ? "" : ": " + MessageSanitizer.sanitize(body));
        if (status >= 500 || RETRYABLE_4XX.contains(status)) {
            return BookingResult.retryable(detail);
        }
        // 400/404/409/422 포함 나머지
        return BookingResult.terminal(detail);
    }

    record BookRequest(long warehouseId, String date) {}
}
