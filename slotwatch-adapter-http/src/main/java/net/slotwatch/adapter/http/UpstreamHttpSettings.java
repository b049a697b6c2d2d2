package net.slotwatch.adapter.http;

import java.time.Duration;

/**
 * 업스트림 REST 엔드포인트 접속 설정.
 *
 * @param suppliesUrl    계수 조회 API 기준 주소
 * @param marketplaceUrl 예약 API 기준 주소
 */
public record UpstreamHttpSettings(
        String suppliesUrl,
        String marketplaceUrl,
        Duration connectTimeout,
        Duration requestTimeout
) {
    public static final String DEFAULT_SUPPLIES_URL = "https://supplies-api.wildberries.ru";
    public static final String DEFAULT_MARKETPLACE_URL = "https://marketplace-api.wildberries.ru";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public UpstreamHttpSettings {
        suppliesUrl = requireBaseUrl(suppliesUrl, "suppliesUrl");
        marketplaceUrl = requireBaseUrl(marketplaceUrl, "marketplaceUrl");
        connectTimeout = resolveTimeout(connectTimeout, DEFAULT_CONNECT_TIMEOUT);
        requestTimeout = resolveTimeout(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
    }

    public static UpstreamHttpSettings defaults() {
        return new UpstreamHttpSettings(DEFAULT_SUPPLIES_URL, DEFAULT_MARKETPLACE_URL, null, null);
    }

    private static Duration resolveTimeout(Duration candidate, Duration fallback) {
        if (candidate == null || candidate.isZero() || candidate.isNegative()) {
            return fallback;
        }
        return candidate;
    }

    private static String requireBaseUrl(String url, String name) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        String trimmed = url.trim();
        // 경로 결합 시 '//' 방지
        while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        return trimmed;
    }
}
