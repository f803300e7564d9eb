package com.dealrelay.core.http;

import com.dealrelay.core.model.RelayConfig;
import com.dealrelay.core.util.StructuredLog;
import com.dealrelay.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 단축/리다이렉트 도메인만 골라 최종 도착 URL을 구한다 (best-effort).
 * - 비활성이거나 리다이렉트 도메인이 아니면 네트워크 없이 입력 그대로 반환
 * - HEAD 1회(리다이렉트 추적, 제한 시간) → 2xx면 도착 URL을 정규화해 반환
 * - 전송 오류/타임아웃/비성공 상태는 원래 URL 반환 (파이프라인 실패로 번지지 않음)
 */
public final class RedirectResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RedirectResolver.class);
    private static final StructuredLog SLOG = StructuredLog.get(RedirectResolver.class);
    private static final String UA = "Mozilla/5.0 (compatible; dealrelay/0.3)";

    private final RelayConfig.Resolver cfg;
    private final UrlNormalizer normalizer;
    private final HttpSender sender;
    private final List<String> domains;

    public RedirectResolver(RelayConfig.Resolver cfg, UrlNormalizer normalizer) {
        this(cfg, normalizer, HttpSender.of(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(cfg.timeout())
                .build()));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public RedirectResolver(RelayConfig.Resolver cfg, UrlNormalizer normalizer, HttpSender sender) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.domains = cfg.redirectDomains().stream()
                .map(d -> d.toLowerCase(Locale.ROOT))
                .toList();
    }

    /** 리다이렉트 도메인 부분 문자열을 포함하면 true */
    public boolean needsResolution(String url) {
        if (url == null) return false;
        String lower = url.toLowerCase(Locale.ROOT);
        for (String d : domains) {
            if (!d.isEmpty() && lower.contains(d)) return true;
        }
        return false;
    }

    public String resolve(String url) {
        if (url == null || url.isBlank()) return url;
        if (!cfg.enabled() || !needsResolution(url)) return url;

        long t0 = System.nanoTime();
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(cfg.timeout())
                    .method("HEAD", HttpRequest.BodyPublishers.noBody())
                    .header("User-Agent", UA)
                    .build();
            HttpResponse<String> resp = sender.send(req);
            int status = resp.statusCode();
            long ms = (System.nanoTime() - t0) / 1_000_000;
            if (status < 200 || status >= 300) {
                SLOG.warn("resolve-status", "url", url, "status", status, "ms", ms);
                return url;
            }
            String landed = normalizer.normalize(resp.uri().toString());
            LOG.debug("Resolved {} -> {} ({} ms)", url, landed, ms);
            return landed.isEmpty() ? url : landed;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return url;
        } catch (Exception e) {
            SLOG.warn("resolve-failed", "url", url, "error", e.getClass().getSimpleName(), "message", e.getMessage());
            return url;
        }
    }
}
